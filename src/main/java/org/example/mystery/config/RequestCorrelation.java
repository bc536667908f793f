package org.example.mystery.config;

public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String SESSION_ATTRIBUTE_NAME = "sessionId";

    private RequestCorrelation() {
    }
}
