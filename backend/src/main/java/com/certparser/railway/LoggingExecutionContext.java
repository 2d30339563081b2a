package com.certparser.railway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

public class LoggingExecutionContext implements ExecutionContext {
    private static final Logger log = LoggerFactory.getLogger(LoggingExecutionContext.class);

    private final String operation;
    private final ExecutionContext inner;

    public LoggingExecutionContext(String operation) {
        this(operation, PassThroughExecutionContext.INSTANCE);
    }

    public LoggingExecutionContext(String operation, ExecutionContext inner) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation name is required");
        }
        this.operation = operation;
        this.inner = inner == null ? PassThroughExecutionContext.INSTANCE : inner;
    }

    public String operation() {
        return operation;
    }

    @Override
    public <T> Result<T> execute(Supplier<Result<T>> computation) {
        long startedNanos = System.nanoTime();
        log.info("{} started", operation);
        Result<T> result;
        try {
            result = inner.execute(computation);
        } catch (RuntimeException | StackOverflowError e) {
            long elapsedMs = Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
            log.error("{} raised after {} ms", operation, elapsedMs, e);
            return Result.failure(ErrorCode.TECHNICAL_ERROR, "Execution failed: " + e.getMessage(), e);
        } catch (Error e) {
            long elapsedMs = Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
            log.error("{} aborted after {} ms", operation, elapsedMs, e);
            throw e;
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
        if (result.isSuccess()) {
            log.info("{} finished SUCCESS in {} ms", operation, elapsedMs);
        } else {
            FailureDescription error = result.unwrapFailure();
            log.warn("{} finished FAILURE in {} ms code={} message={}", operation, elapsedMs, error.code(), error.message());
        }
        return result;
    }
}
