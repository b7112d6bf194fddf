package com.propertyintel.insights.output;

import com.propertyintel.insights.model.MetricKind;
import lombok.Getter;

@Getter
public class MetricWriteException extends RuntimeException {

    private final MetricKind kind;

    public MetricWriteException(MetricKind kind, String message) {
        super(kind.table() + ": " + message);
        this.kind = kind;
    }

    public MetricWriteException(MetricKind kind, String message, Throwable cause) {
        super(kind.table() + ": " + message, cause);
        this.kind = kind;
    }
}
