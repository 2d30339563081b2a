package com.certparser.railway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs the computation inside a Spring-managed transaction: commit on success, rollback on failure
 * or on any exception. An {@link Error} is rethrown after the rollback. JDBC templates bound to the
 * same data source join the transaction.
 */
public class TransactionalExecutionContext implements ExecutionContext {
    private static final Logger log = LoggerFactory.getLogger(TransactionalExecutionContext.class);
    static final String BEGIN_FAILURE_MESSAGE = "Transaction could not be started";

    private final PlatformTransactionManager transactionManager;

    public TransactionalExecutionContext(PlatformTransactionManager transactionManager) {
        this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager");
    }

    @Override
    public <T> Result<T> execute(Supplier<Result<T>> computation) {
        TransactionStatus status;
        try {
            status = transactionManager.getTransaction(new DefaultTransactionDefinition());
        } catch (RuntimeException e) {
            log.error("Could not start transaction", e);
            return Result.failure(ErrorCode.DATABASE_ERROR, BEGIN_FAILURE_MESSAGE, e);
        }
        try {
            Result<T> result = computation.get();
            if (result.isSuccess()) {
                transactionManager.commit(status);
            } else {
                log.debug("Rolling back transaction after failure {}", result.unwrapFailure().code());
                transactionManager.rollback(status);
            }
            return result;
        } catch (RuntimeException e) {
            rollbackQuietly(status, e);
            return Result.failure(ErrorCode.DATABASE_ERROR, "Transaction failed: " + e.getMessage(), e);
        } catch (Error e) {
            rollbackQuietly(status, e);
            throw e;
        }
    }

    private void rollbackQuietly(TransactionStatus status, Throwable original) {
        if (status.isCompleted()) {
            return;
        }
        try {
            transactionManager.rollback(status);
        } catch (RuntimeException rollbackError) {
            original.addSuppressed(rollbackError);
            log.error("Rollback failed", rollbackError);
        }
    }
}
