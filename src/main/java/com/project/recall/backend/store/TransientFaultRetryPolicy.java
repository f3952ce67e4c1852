package com.project.recall.backend.store;

import com.project.recall.backend.config.ReviewProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry for store calls that fail because the database is briefly unavailable
 * (restarting, connection dropped, pool exhausted). Attempt n waits n × base delay.
 * Anything that is not a transient fault is rethrown at once.
 */
@Slf4j
@Component
public class TransientFaultRetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;

    @Autowired
    public TransientFaultRetryPolicy(ReviewProperties properties) {
        this(properties.getDelivery().getStoreRetryAttempts(), properties.getDelivery().getStoreRetryDelay());
    }

    public TransientFaultRetryPolicy(int maxAttempts, Duration baseDelay) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelay = baseDelay;
    }

    public <T> T call(String operation, Supplier<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!isTransient(e) || attempt >= maxAttempts) {
                    throw e;
                }
                long waitMillis = baseDelay.toMillis() * attempt;
                log.warn("Store call {} failed with a transient fault (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxAttempts, waitMillis, e.getMessage());
                sleep(waitMillis);
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    static boolean isTransient(Throwable error) {
        return error instanceof TransientDataAccessException
                || error instanceof RecoverableDataAccessException
                || error instanceof CannotCreateTransactionException;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry a store call", e);
        }
    }
}
