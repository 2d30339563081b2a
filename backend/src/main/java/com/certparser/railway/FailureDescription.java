package com.certparser.railway;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable description of a failed computation.
 *
 * @param code      classification of the failure
 * @param message   human readable, never blank
 * @param cause     optional underlying exception, kept for logging only
 * @param timestamp when the failure was recorded
 */
public record FailureDescription(ErrorCode code, String message, Throwable cause, Instant timestamp) {

    public FailureDescription {
        Objects.requireNonNull(code, "code");
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("failure message must not be blank");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static FailureDescription of(ErrorCode code, String message) {
        return new FailureDescription(code, message, null, Instant.now());
    }

    public static FailureDescription of(ErrorCode code, String message, Throwable cause) {
        return new FailureDescription(code, message, cause, Instant.now());
    }

    public boolean hasCause() {
        return cause != null;
    }

    public FailureDescription withMessage(String newMessage) {
        return new FailureDescription(code, newMessage, cause, timestamp);
    }

    public String fullStackTrace() {
        if (cause == null) {
            return "";
        }
        StringWriter writer = new StringWriter();
        cause.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
