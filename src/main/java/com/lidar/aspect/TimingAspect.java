package com.lidar.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * Logs how long {@link Timed} methods take, and how long they ran before failing
 */
@Aspect
@Component
@Slf4j
public class TimingAspect {

    @Around("@annotation(timed)")
    public Object measureExecutionTime(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        long startTime = System.currentTimeMillis();
        String operation = operationName(joinPoint, timed);

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            switch (timed.logLevel()) {
                case INFO -> log.info("{} executed in {}ms", operation, duration);
                case WARN -> log.warn("{} executed in {}ms", operation, duration);
                default -> log.debug("{} executed in {}ms", operation, duration);
            }
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            // the caller decides whether this is fatal, so no stack trace here
            log.warn("{} failed after {}ms: {}", operation, duration, e.getMessage());
            throw e;
        }
    }

    private String operationName(ProceedingJoinPoint joinPoint, Timed timed) {
        if (!timed.value().isEmpty()) {
            return timed.value();
        }
        return joinPoint.getSignature().getDeclaringType().getSimpleName()
                + "#" + joinPoint.getSignature().getName();
    }
}
