package com.strata.execution;

import com.strata.domain.FailureKind;
import com.strata.storage.StorageOperationException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed action may be attempted again.
 *
 * Storage engine failures carry their own kind. Everything else is classified by type:
 * timeouts, lock contention and transient connectivity are retryable, invalid arguments
 * and non-transient data access errors are terminal. Unknown errors are retryable so a
 * single glitch never blocks a pair for good.
 */
@Component
public class ExecutionFailureClassifier {

    public FailureKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof StorageOperationException) {
            FailureKind kind = ((StorageOperationException) cause).getFailureKind();
            return kind != null ? kind : FailureKind.RETRYABLE;
        }
        if (cause instanceof TimeoutException) {
            return FailureKind.RETRYABLE;
        }
        if (cause instanceof IllegalArgumentException || cause instanceof IllegalStateException) {
            return FailureKind.TERMINAL;
        }
        if (cause instanceof TransientDataAccessException
            || cause instanceof RecoverableDataAccessException
            || cause instanceof PessimisticLockingFailureException
            || cause instanceof QueryTimeoutException) {
            return FailureKind.RETRYABLE;
        }
        if (cause instanceof NonTransientDataAccessException) {
            return FailureKind.TERMINAL;
        }
        return FailureKind.RETRYABLE;
    }

    /**
     * Short machine-readable code for the log entry.
     */
    public String errorCode(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof StorageOperationException) {
            String operation = ((StorageOperationException) cause).getOperation();
            return operation != null ? "STORAGE_" + operation.toUpperCase() : "STORAGE_ERROR";
        }
        if (cause instanceof TimeoutException) {
            return "TIMEOUT";
        }
        return cause.getClass().getSimpleName();
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
