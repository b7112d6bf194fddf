package com.propertyintel.insights.client.exception;

/** Credentials rejected or expired. Never retried. */
public class UpstreamAuthException extends UpstreamException {
    public UpstreamAuthException(String message) { super(message); }
    public UpstreamAuthException(String message, Throwable cause) { super(message, cause); }
}
