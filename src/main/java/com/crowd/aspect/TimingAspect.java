package com.crowd.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * Logs the execution time of methods annotated with {@link Timed}
 * and keeps the last duration per thread for the controllers' elapsed field
 */
@Aspect
@Component
@Slf4j
public class TimingAspect {

    private static final ThreadLocal<Long> EXECUTION_TIME = new ThreadLocal<>();

    @Around("@annotation(timed)")
    public Object measureExecutionTime(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        long startTime = System.currentTimeMillis();
        String operation = timed.value().isEmpty()
                ? joinPoint.getSignature().getDeclaringType().getSimpleName() + "#" + joinPoint.getSignature().getName()
                : timed.value();
        
        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            EXECUTION_TIME.set(duration);
            
            if (timed.logLevel() == Timed.LogLevel.INFO) {
                log.info("{} executed in {}ms", operation, duration);
            } else {
                log.debug("{} executed in {}ms", operation, duration);
            }
            
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            EXECUTION_TIME.set(duration);
            log.error("{} failed after {}ms", operation, duration, e);
            throw e;
        }
    }
    
    /**
     * Get the execution time for the current thread and clear it
     */
    public static String getAndClearExecutionTime() {
        Long duration = EXECUTION_TIME.get();
        EXECUTION_TIME.remove();
        return duration != null ? duration + "ms" : "0ms";
    }
}
