package com.example.chat.shared.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Times and counts invocations through {@link MonitoringAspect}. A method-level annotation
 * takes precedence over the one on its class.
 *
 * <p>Metrics are {@code chat.<layer>.latency} and {@code chat.<layer>.calls}, tagged with class,
 * method and outcome ({@code success}, {@code rejected} for {@code ChatException}, {@code error}).
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface Monitored {

    /** Layer name used in the metric names, e.g. "store" or "voice". */
    String value();

    /** Calls slower than this are logged at warn. Zero or less turns the check off. */
    long slowThresholdMs() default 1000;
}
