package com.example.chat.shared.service;

import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Runs a unit of work in its own transaction and repeats it when a concurrent writer won
 * the race (stale version, lock timeout, serialization failure). Each attempt re-reads
 * the aggregate, so the work must be free of side effects outside the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OptimisticRetryTemplate {

    private static final String SERIALIZATION_FAILURE_STATE = "40001";
    // H2: concurrent update in MVStore, lock timeout
    private static final Set<Integer> RETRYABLE_VENDOR_CODES = Set.of(90131, 50200);

    private final TransactionTemplate transactionTemplate;
    private final AppProperties appProperties;
    private final MonitoringConfig.ChatMetricsCollector metricsCollector;

    public <T> T execute(String operation, Supplier<T> work) {
        int maxAttempts = appProperties.getStore().getMaxRetryAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (RuntimeException e) {
                if (!isRetryable(e)) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.warn("Giving up on '{}' after {} conflicting attempts", operation, attempt);
                    throw e;
                }
                metricsCollector.incrementCounter("chat.store.retries", "operation", operation);
                log.debug("Conflict on '{}' (attempt {}): {}", operation, attempt, e.getMessage());
                pause(attempt, e);
            }
        }
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }

    static boolean isRetryable(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ConcurrencyFailureException || t instanceof TransientDataAccessException) {
                return true;
            }
            if (t instanceof SQLException sql
                    && (SERIALIZATION_FAILURE_STATE.equals(sql.getSQLState())
                        || RETRYABLE_VENDOR_CODES.contains(sql.getErrorCode()))) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private void pause(int attempt, RuntimeException conflict) {
        long base = appProperties.getStore().getRetryBackoffMs();
        if (base <= 0) {
            return;
        }
        long ceiling = base * Math.min(attempt, 10);
        try {
            Thread.sleep(ThreadLocalRandom.current().nextLong(ceiling + 1));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw conflict;
        }
    }
}
