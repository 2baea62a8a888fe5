package com.fhi.dog_walking.tools;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * A method-level profiler for service methods.
 *
 * Wraps (through @Aspect) the methods of the service layer and logs:
 * - The method's execution time
 * - A warning if the call was slow
 *
 * This profiler is complementary to {@link ProfilingCommandListener}, which logs every
 * Mongo command individually at the driver level. This class gives the overview of a whole
 * service call (conversion, validation and the store round trip).
 */
@Aspect
@Component
@Slf4j
public class PerformanceProfiler 
{
    @Value("${profiling.performance.enabled:false}")
    private boolean profilerEnabled;

    @Value("${profiling.performance.slowCallThreshold:500}")
    private long slowCallThreshold;

    @Value("${profiling.performance.logLinePrefix:PROFILING---}")
    private String logLinePrefix;

    /**
     * When logging the profiled method, also print the types of its arguments.
     * Values are never printed: payloads hold personal data (emails, phones, addresses).
     */
    private static final boolean PRINT_ARGS_FOR_JOIN_POINT = false;


    @Around("execution(* com.fhi.dog_walking.service..*(..))")
    public Object profile(ProceedingJoinPoint joinPoint) throws Throwable 
    {
        if (!profilerEnabled) 
        {   return joinPoint.proceed();
        }

        long start = System.currentTimeMillis();
        try 
        {   return joinPoint.proceed();
        } 
        finally 
        {   long duration = System.currentTimeMillis() - start; 

            String joinPointArgsPrint = Arrays.stream(joinPoint.getArgs())
                                              .map(arg -> arg == null ? "null" : arg.getClass().getSimpleName())
                                              .collect(Collectors.joining(", "));
            String joinPointPrint = joinPoint.getSignature().toShortString() + 
                                   ( PRINT_ARGS_FOR_JOIN_POINT ? "(" + joinPointArgsPrint + ")"
                                                               : ""
                                   ); 

            log.info("{} [{} ms] for [{}]", logLinePrefix, duration, joinPointPrint);

            if (duration > slowCallThreshold) 
            {  log.warn("{} SLOW CALL DETECTED: [{}] took {} ms", logLinePrefix, joinPoint.getSignature().toShortString(), duration);
            }
        }
    }
}
