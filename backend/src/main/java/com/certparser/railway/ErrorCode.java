package com.certparser.railway;

/**
 * Closed classification of every failure a {@link Result} can carry.
 * Client-class codes describe a problem with the input or the caller; server-class codes
 * describe a problem inside this service or one of its collaborators.
 */
public enum ErrorCode {
    VALIDATION_ERROR(true),
    AUTHENTICATION_ERROR(true),
    AUTHORIZATION_ERROR(true),
    NOT_FOUND(true),
    BUSINESS_RULE_ERROR(true),
    RATE_LIMIT_ERROR(true),
    TECHNICAL_ERROR(false),
    DATABASE_ERROR(false),
    CONFIGURATION_ERROR(false),
    EXTERNAL_SERVICE_ERROR(false),
    SERVICE_UNAVAILABLE_ERROR(false),
    TIMEOUT_ERROR(false),
    UNKNOWN_ERROR(false);

    private final boolean clientError;

    ErrorCode(boolean clientError) {
        this.clientError = clientError;
    }

    public boolean isClientError() {
        return clientError;
    }
}
