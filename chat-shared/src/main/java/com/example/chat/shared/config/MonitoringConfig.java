package com.example.chat.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the messaging core. Meters that are known up front are registered by
 * {@link #chatMetrics()}; everything else goes through {@link ChatMetricsCollector}.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder chatMetrics() {
        return registry -> {
            registry.counter("chat.messages.sent", "type", "total");
            registry.counter("chat.fanout.events", "result", "delivered");
            registry.counter("chat.fanout.events", "result", "skipped");
            registry.counter("chat.translation.calls", "result", "fallback");
            registry.counter("chat.speech.calls", "result", "fallback");
            registry.counter("chat.store.retries", "operation", "total");

            Timer.builder("chat.store.latency")
                    .description("Time taken by a durable store operation including retries")
                    .register(registry);
        };
    }

    @Bean
    public ChatMetricsCollector chatMetricsCollector(MeterRegistry registry) {
        return new ChatMetricsCollector(registry);
    }

    public static class ChatMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public ChatMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            incrementCounter(name, 1, tags);
        }

        public void incrementCounter(String name, double amount, String... tags) {
            counters.computeIfAbsent(key(name, tags), k -> registry.counter(name, tags)).increment(amount);
        }

        public void recordTimer(String name, long durationMs, String... tags) {
            timers.computeIfAbsent(key(name, tags), k -> Timer.builder(name).tags(tags).register(registry))
                    .record(durationMs, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, long value, String... tags) {
            gauges.computeIfAbsent(key(name, tags), k -> {
                AtomicLong gauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), gauge);
                return gauge;
            }).set(value);
        }

        public long getCounterValue(String name, String... tags) {
            Counter counter = counters.get(key(name, tags));
            return counter != null ? (long) counter.count() : 0;
        }

        private static String key(String name, String... tags) {
            return name + "_" + String.join("_", tags);
        }
    }
}
