package com.example.chat.shared.service;

import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("OptimisticRetryTemplate Unit Tests")
class OptimisticRetryTemplateTest {

    @Mock
    private TransactionTemplate transactionTemplate;

    @Mock
    private MonitoringConfig.ChatMetricsCollector metricsCollector;

    private OptimisticRetryTemplate retryTemplate;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getStore().setMaxRetryAttempts(3);
        properties.getStore().setRetryBackoffMs(0);
        when(transactionTemplate.execute(any())).thenAnswer(invocation ->
                invocation.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
        retryTemplate = new OptimisticRetryTemplate(transactionTemplate, properties, metricsCollector);
    }

    @Test
    @DisplayName("Should repeat the work after a version conflict")
    void shouldRetryOnVersionConflict() {
        AtomicInteger attempts = new AtomicInteger();

        String result = retryTemplate.execute("send", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new OptimisticLockingFailureException("stale version");
            }
            return "saved";
        });

        assertThat(result).isEqualTo("saved");
        assertThat(attempts).hasValue(3);
        verify(metricsCollector, times(2)).incrementCounter(eq("chat.store.retries"), anyString(), eq("send"));
    }

    @Test
    @DisplayName("Should give up once the attempt budget is spent")
    void shouldGiveUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retryTemplate.execute("send", () -> {
            attempts.incrementAndGet();
            throw new OptimisticLockingFailureException("stale version");
        })).isInstanceOf(OptimisticLockingFailureException.class);

        assertThat(attempts).hasValue(3);
    }

    @Test
    @DisplayName("Should not retry failures that are not conflicts")
    void shouldPropagateOtherFailuresImmediately() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retryTemplate.execute("create", () -> {
            attempts.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate pair");
        })).isInstanceOf(DataIntegrityViolationException.class);

        assertThat(attempts).hasValue(1);
        verify(metricsCollector, never()).incrementCounter(anyString(), anyString(), anyString());
    }

    @Test
    void recognisesWrappedLockTimeouts() {
        SQLException lockTimeout = new SQLException("Timeout trying to lock table", "HYT00", 50200);
        RuntimeException wrapped = new IllegalStateException("action failed", new RuntimeException(lockTimeout));

        assertThat(OptimisticRetryTemplate.isRetryable(wrapped)).isTrue();
        assertThat(OptimisticRetryTemplate.isRetryable(new IllegalStateException("boom"))).isFalse();
    }
}
