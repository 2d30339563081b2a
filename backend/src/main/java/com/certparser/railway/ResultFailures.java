package com.certparser.railway;

public final class ResultFailures {

    private ResultFailures() {
    }

    public static <T> Result<T> validationError(String message) {
        return Result.failure(ErrorCode.VALIDATION_ERROR, message);
    }

    public static <T> Result<T> authenticationError(String message) {
        return Result.failure(ErrorCode.AUTHENTICATION_ERROR, message);
    }

    public static <T> Result<T> notFound(String message) {
        return Result.failure(ErrorCode.NOT_FOUND, message);
    }

    public static <T> Result<T> technicalError(String message, Throwable cause) {
        return Result.failure(ErrorCode.TECHNICAL_ERROR, message, cause);
    }

    public static <T> Result<T> databaseError(String message, Throwable cause) {
        return Result.failure(ErrorCode.DATABASE_ERROR, message, cause);
    }

    public static <T> Result<T> configurationError(String message) {
        return Result.failure(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public static <T> Result<T> externalServiceError(String message) {
        return Result.failure(ErrorCode.EXTERNAL_SERVICE_ERROR, message);
    }

    /**
     * Failure classified by the exception's {@link FaultCategory}. The message is kept as given; the
     * exception travels only as the cause.
     */
    public static <T> Result<T> fromException(String message, Throwable error) {
        ErrorCode code = FaultCategory.classify(error).errorCode();
        return Result.failure(code, message, error);
    }
}
