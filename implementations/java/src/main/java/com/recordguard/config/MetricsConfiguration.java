package com.recordguard.config;

import com.recordguard.domain.model.PipelineResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Timers around the pipeline's suspension points and stages, plus outcome
 * counters. No request or result text is ever used as a tag.
 */
@Configuration
@Slf4j
public class MetricsConfiguration {

    /**
     * Times every text oracle call.
     */
    @Aspect
    @Component
    public static class OracleTimingAspect {

        private final MeterRegistry meterRegistry;

        public OracleTimingAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.recordguard.application.guardrail.TextOracle+.complete(..))")
        public Object timeOracleCall(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "guardrail.oracle.call", "Text oracle call timing", joinPoint);
        }
    }

    /**
     * Times guardrail stage calls, oracle time included.
     */
    @Aspect
    @Component
    public static class StageTimingAspect {

        private final MeterRegistry meterRegistry;

        public StageTimingAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(public * com.recordguard.application.guardrail.*Stage.*(..))")
        public Object timeStage(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "guardrail.stage", "Guardrail stage timing", joinPoint);
        }
    }

    /**
     * Times query execution against the record store.
     */
    @Aspect
    @Component
    public static class QueryExecutionTimingAspect {

        private final MeterRegistry meterRegistry;

        public QueryExecutionTimingAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.recordguard.domain.repository.RecordQueryExecutor+.execute(..))")
        public Object timeExecution(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "guardrail.query.execution", "Record store query timing", joinPoint);
        }
    }

    /**
     * Counts pipeline runs by terminal state.
     */
    @Aspect
    @Component
    @Slf4j
    public static class PipelineOutcomeAspect {

        private final MeterRegistry meterRegistry;

        public PipelineOutcomeAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized pipeline outcome metrics");
        }

        @Around("execution(* com.recordguard.application.PipelineOrchestrator.handle(..))")
        public Object countOutcome(ProceedingJoinPoint joinPoint) throws Throwable {
            Object result = joinPoint.proceed();
            if (result instanceof PipelineResult) {
                PipelineResult pipelineResult = (PipelineResult) result;
                meterRegistry.counter("guardrail.pipeline.outcome",
                    "outcome", pipelineResult.getOutcome().name(),
                    "sanitized", Boolean.toString(pipelineResult.isSanitized())).increment();
            }
            return result;
        }
    }

    private static Object timed(
            MeterRegistry meterRegistry,
            String name,
            String description,
            ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();

        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Object result = joinPoint.proceed();

            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", "success")
                .description(description)
                .register(meterRegistry));

            return result;

        } catch (Exception e) {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", "failure")
                .description(description)
                .register(meterRegistry));

            throw e;
        }
    }
}
