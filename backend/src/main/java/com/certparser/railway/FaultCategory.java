package com.certparser.railway;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.time.DateTimeException;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeoutException;

/**
 * Ordered mapping from native exception types to {@link ErrorCode}s. Categories are checked in
 * declaration order, so a {@link FileNotFoundException} is NOT_FOUND even though it is also an
 * {@link IOException}.
 */
public enum FaultCategory {
    VALIDATION(ErrorCode.VALIDATION_ERROR, List.of(IllegalArgumentException.class, DateTimeException.class)),
    NOT_FOUND(ErrorCode.NOT_FOUND, List.of(NoSuchElementException.class, FileNotFoundException.class, NoSuchFileException.class)),
    PERMISSION(ErrorCode.AUTHORIZATION_ERROR, List.of(SecurityException.class, AccessDeniedException.class)),
    TIMEOUT(ErrorCode.TIMEOUT_ERROR, List.of(TimeoutException.class, SocketTimeoutException.class, HttpTimeoutException.class)),
    CONNECTIVITY(
        ErrorCode.EXTERNAL_SERVICE_ERROR,
        List.of(ConnectException.class, UnknownHostException.class, NoRouteToHostException.class, IOException.class)
    ),
    UNKNOWN(ErrorCode.UNKNOWN_ERROR, List.of());

    private static final int MAX_CAUSE_DEPTH = 16;

    private final ErrorCode errorCode;
    private final List<Class<? extends Throwable>> types;

    FaultCategory(ErrorCode errorCode, List<Class<? extends Throwable>> types) {
        this.errorCode = errorCode;
        this.types = types;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Classifies the exception itself, then each of its causes in turn, stopping at the first
     * throwable that falls into a known category.
     */
    public static FaultCategory classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < MAX_CAUSE_DEPTH) {
            FaultCategory category = categoryOf(current);
            if (category != UNKNOWN) {
                return category;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
            depth++;
        }
        return UNKNOWN;
    }

    private static FaultCategory categoryOf(Throwable error) {
        for (FaultCategory category : values()) {
            for (Class<? extends Throwable> type : category.types) {
                if (type.isInstance(error)) {
                    return category;
                }
            }
        }
        return UNKNOWN;
    }
}
