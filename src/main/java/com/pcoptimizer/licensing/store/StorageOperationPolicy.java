package com.pcoptimizer.licensing.store;

import com.pcoptimizer.licensing.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Timeout, retry count and backoff applied to every storage call.
 * <p>
 * Transient failures are retried up to {@code maxRetries} times, waiting {@code backoff * attempt}
 * between tries. Once retries run out, or on any other storage failure, the call fails with
 * {@link StorageUnavailableException}. Exceptions that are not storage failures pass through untouched.
 */
public class StorageOperationPolicy {

    private static final Logger log = LoggerFactory.getLogger(StorageOperationPolicy.class);

    private final Duration timeout;
    private final int maxRetries;
    private final Duration backoff;

    public StorageOperationPolicy(Duration timeout, int maxRetries, Duration backoff) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.backoff = backoff == null ? Duration.ZERO : backoff;
    }

    public static StorageOperationPolicy from(AppProperties.Storage storage) {
        return new StorageOperationPolicy(storage.timeout(), storage.maxRetries(), storage.backoff());
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Timeout in whole seconds, as transaction managers take it. Never less than one.
     */
    public int timeoutSeconds() {
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, (timeout.toMillis() + 999) / 1000));
    }

    public int maxRetries() {
        return maxRetries;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (DataAccessException | TransactionException e) {
                if (!isTransient(e)) {
                    log.error("Storage operation {} failed: {}", operation, e.getMessage());
                    throw new StorageUnavailableException("Storage operation " + operation + " failed", e);
                }
                if (attempt >= maxRetries) {
                    log.error("Storage operation {} failed after {} attempt(s): {}", operation, attempt + 1, e.getMessage());
                    throw new StorageUnavailableException(
                            "Storage operation " + operation + " failed after " + (attempt + 1) + " attempt(s)", e);
                }
                attempt++;
                log.warn("Transient failure in storage operation {} (attempt {}/{}): {}",
                        operation, attempt, maxRetries + 1, e.getMessage());
                pause(operation, backoff.multipliedBy(attempt), e);
            }
        }
    }

    static boolean isTransient(RuntimeException e) {
        return e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException
                || e instanceof CannotCreateTransactionException
                || e instanceof TransactionTimedOutException;
    }

    private static void pause(String operation, Duration delay, RuntimeException cause) {
        if (delay.isZero()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            StorageUnavailableException ex =
                    new StorageUnavailableException("Interrupted while retrying storage operation " + operation, cause);
            ex.addSuppressed(ie);
            throw ex;
        }
    }
}
