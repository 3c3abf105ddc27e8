package com.example.chat.shared.aspect;

import com.example.chat.shared.config.MonitoringConfig;
import com.example.chat.shared.exception.ChatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.ChatMetricsCollector metricsCollector;

    @Around("@within(com.example.chat.shared.aspect.Monitored) || @annotation(com.example.chat.shared.aspect.Monitored)")
    public Object monitorMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Monitored monitored = resolve(signature.getMethod());
        if (monitored == null) {
            return joinPoint.proceed();
        }

        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = signature.getName();
        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long duration = record(monitored, className, methodName, "success", startTime);
            if (monitored.slowThresholdMs() > 0 && duration > monitored.slowThresholdMs()) {
                log.warn("Slow call {}.{} ({}) took {}ms", className, methodName, monitored.value(), duration);
            }
            return result;
        } catch (ChatException e) {
            long duration = record(monitored, className, methodName, "rejected", startTime);
            log.debug("{}.{} rejected after {}ms: {} {}", className, methodName, duration, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (Exception e) {
            long duration = record(monitored, className, methodName, "error", startTime);
            metricsCollector.incrementCounter("chat.errors", "type", monitored.value(), "class", className, "method", methodName);
            log.error("{}.{} ({}) failed after {}ms: {}", className, methodName, monitored.value(), duration, e.getMessage());
            throw e;
        }
    }

    private static Monitored resolve(Method method) {
        Monitored monitored = method.getAnnotation(Monitored.class);
        return monitored != null ? monitored : method.getDeclaringClass().getAnnotation(Monitored.class);
    }

    private long record(Monitored monitored, String className, String methodName, String status, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        String prefix = "chat." + monitored.value();
        metricsCollector.recordTimer(prefix + ".latency", duration, "class", className, "method", methodName, "status", status);
        metricsCollector.incrementCounter(prefix + ".calls", "class", className, "method", methodName, "status", status);
        return duration;
    }
}
