package com.propertyintel.insights.client.exception;

/** Body could not be parsed or did not have the expected shape. */
public class UpstreamResponseException extends UpstreamException {
    public UpstreamResponseException(String message) { super(message); }
    public UpstreamResponseException(String message, Throwable cause) { super(message, cause); }
}
