package com.propertyintel.insights.client.exception;

/** Connection, timeout, throttling or 5xx failure. Retried by the insightsApi retry policy. */
public class UpstreamTransportException extends UpstreamException {
    public UpstreamTransportException(String message) { super(message); }
    public UpstreamTransportException(String message, Throwable cause) { super(message, cause); }
}
