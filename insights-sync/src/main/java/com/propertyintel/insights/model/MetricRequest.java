package com.propertyintel.insights.model;

/**
 * One (metric type, group value) pair polled for a query kind,
 * e.g. (CONVERSION, conversion_rate).
 */
public record MetricRequest(String metricType, String groupValue) {

    @Override
    public String toString() {
        return metricType + ":" + groupValue;
    }
}
