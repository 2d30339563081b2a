package com.certparser.masterlist.model;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

public record HttpExchangeResult(
    String requestedUrl,
    int statusCode,
    byte[] bodyBytes,
    int attempts,
    Duration duration,
    String errorCode,
    Exception error
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isTransportFailure() {
        return errorCode != null;
    }

    public String bodyText() {
        return bodyBytes == null ? "" : new String(bodyBytes, StandardCharsets.UTF_8);
    }
}
