package com.propertyintel.insights.model;

public enum TriggerSource {
    SCHEDULED, MANUAL, STARTUP
}
