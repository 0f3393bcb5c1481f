package com.techportfolio.portfolio.recovery;

import com.techportfolio.common.exception.StorageException;
import com.techportfolio.portfolio.config.PortfolioProperties;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import io.r2dbc.spi.R2dbcTransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.util.concurrent.TimeoutException;

/**
 * Recovery policy for storage calls.
 *
 * <p>Connectivity failures and timeouts are retried with exponential backoff and
 * surface as {@link StorageException} once retries are exhausted. Every other error
 * (constraint violations, mapping errors, domain exceptions) passes through
 * untouched and is never retried.
 *
 * <p>Retrying resubscribes the storage call, which acquires a fresh pooled connection;
 * no connection is held across the backoff delay.
 */
@Component
public class StorageRecovery {

    private static final Logger log = LoggerFactory.getLogger(StorageRecovery.class);

    private final PortfolioProperties.Storage settings;

    public StorageRecovery(PortfolioProperties properties) {
        this.settings = properties.getStorage();
    }

    public <T> Mono<T> recover(Mono<T> call, String operation) {
        return call.retryWhen(retrySpec(operation));
    }

    /**
     * Collection reads are materialized before retrying: a failure after some rows
     * were read restarts the whole read, and only the rows of the attempt that
     * completed reach the caller.
     */
    public <T> Flux<T> recover(Flux<T> call, String operation) {
        return call.collectList()
            .retryWhen(retrySpec(operation))
            .flatMapIterable(rows -> rows);
    }

    /**
     * @return {@code true} when {@code error} means storage was unreachable or too slow,
     *         as opposed to a well-formed rejection of the request
     */
    public static boolean isStorageFailure(Throwable error) {
        return error instanceof TransientDataAccessException
            || error instanceof DataAccessResourceFailureException
            || error instanceof R2dbcTransientException
            || error instanceof R2dbcNonTransientResourceException
            || error instanceof TimeoutException;
    }

    private RetryBackoffSpec retrySpec(String operation) {
        return Retry.backoff(settings.getMaxRetries(), settings.getMinBackoff())
            .maxBackoff(settings.getMaxBackoff())
            .filter(StorageRecovery::isStorageFailure)
            .doBeforeRetry(signal -> log.warn("STORAGE_RETRY operation={} attempt={} cause={}",
                operation, signal.totalRetries() + 1, signal.failure().toString()))
            .onRetryExhaustedThrow((spec, signal) -> {
                log.error("STORAGE_RETRY_EXHAUSTED operation={} retries={}",
                    operation, signal.totalRetries(), signal.failure());
                return new StorageException(operation, signal.totalRetries() + 1, signal.failure());
            });
    }
}
