package com.byterox.sentinel.observability;

import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Creates spans around the public operations of the scheduler, rule engine,
 * workflow engine, notification dispatcher and outbound clients.
 * <p>
 * Spans cover assembly of the reactive pipeline; subscription happens afterwards.
 */
@Aspect
@Component
public class TracingAspect {

    private final Tracer tracer;

    public TracingAspect(Tracer tracer) {
        this.tracer = tracer;
    }

    @Pointcut("execution(public * com.byterox.sentinel.scheduler..*(..))")
    public void schedulerOperations() {}

    @Pointcut("execution(public * com.byterox.sentinel.rules..*(..))")
    public void ruleOperations() {}

    @Pointcut("execution(public * com.byterox.sentinel.workflow..*(..))")
    public void workflowOperations() {}

    @Pointcut("execution(public * com.byterox.sentinel.notification..*(..))")
    public void notificationOperations() {}

    @Pointcut("execution(public * com.byterox.sentinel.client..*(..))")
    public void clientOperations() {}

    @Around("schedulerOperations()")
    public Object traceSchedulerOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        return traceOperation(joinPoint, "sentinel.scheduler");
    }

    @Around("ruleOperations()")
    public Object traceRuleOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        return traceOperation(joinPoint, "sentinel.rules");
    }

    @Around("workflowOperations()")
    public Object traceWorkflowOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        return traceOperation(joinPoint, "sentinel.workflow");
    }

    @Around("notificationOperations()")
    public Object traceNotificationOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        return traceOperation(joinPoint, "sentinel.notification");
    }

    @Around("clientOperations()")
    public Object traceClientOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        return traceOperation(joinPoint, "sentinel.client");
    }

    private Object traceOperation(ProceedingJoinPoint joinPoint, String prefix) throws Throwable {
        String spanName = prefix + "." + joinPoint.getSignature().getName();
        Span span = tracer.nextSpan().name(spanName);

        try (Tracer.SpanInScope ws = tracer.withSpan(span.start())) {
            MDC.put(SentinelStructuredLogger.MDC_TRACE_ID, span.context().traceId());
            MDC.put(SentinelStructuredLogger.MDC_SPAN_ID, span.context().spanId());

            span.tag("class", joinPoint.getSignature().getDeclaringType().getSimpleName());
            span.tag("method", joinPoint.getSignature().getName());

            return joinPoint.proceed();
        } catch (Throwable t) {
            span.error(t);
            throw t;
        } finally {
            span.end();
            MDC.remove(SentinelStructuredLogger.MDC_TRACE_ID);
            MDC.remove(SentinelStructuredLogger.MDC_SPAN_ID);
        }
    }
}
