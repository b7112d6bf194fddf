package com.propertyintel.insights.client.exception;

/** Base class for any failure talking to the upstream insights API. */
public class UpstreamException extends RuntimeException {
    public UpstreamException(String message) { super(message); }
    public UpstreamException(String message, Throwable cause) { super(message, cause); }
}
