package tech.databroker.platform.shared;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.interceptor.AroundInvoke;
import jakarta.interceptor.Interceptor;
import jakarta.interceptor.InvocationContext;
import org.jboss.logging.Logger;
import tech.databroker.core.result.CommandResult;
import tech.databroker.core.result.ItemQueryResult;
import tech.databroker.core.result.ListQueryResult;
import tech.databroker.platform.config.DataBrokerConfig;

/**
 * CDI Interceptor that instruments handler methods with metrics.
 *
 * Automatically records:
 * - Operation duration (histogram with percentiles)
 * - Operation count by outcome (success/failure/error)
 * - Error count by type
 * - Slow operation warnings (threshold from {@link DataBrokerConfig#slowOperationThreshold()})
 *
 * A call that returns a failure result is counted as "failure"; a call that throws as "error".
 */
@Instrumented
@Interceptor
@Priority(Interceptor.Priority.APPLICATION)
public class InstrumentedInterceptor {

    private static final Logger LOG = Logger.getLogger(InstrumentedInterceptor.class);

    @Inject
    MeterRegistry registry;

    @Inject
    DataBrokerConfig config;

    @AroundInvoke
    public Object instrument(InvocationContext ctx) throws Exception {
        String record = resolveRecord(ctx);
        String operation = resolveOperation(ctx);

        Timer.Sample sample = Timer.start(registry);
        String result = "error";

        try {
            Object returned = ctx.proceed();
            result = classifyOutcome(returned);
            return returned;
        } catch (Exception e) {
            registry.counter("databroker.handler.errors",
                "record", record,
                "operation", operation,
                "error_type", classifyError(e)
            ).increment();
            throw e;
        } finally {
            long durationNanos = sample.stop(Timer.builder("databroker.handler.duration")
                .tag("record", record)
                .tag("operation", operation)
                .tag("result", result)
                .publishPercentileHistogram()
                .register(registry));

            long durationMs = durationNanos / 1_000_000;

            registry.counter("databroker.handler.operations",
                "record", record,
                "operation", operation,
                "result", result
            ).increment();

            if (durationMs > config.slowOperationThreshold().toMillis()) {
                LOG.warnf("Slow data broker operation: %s %s took %dms",
                    record, operation, durationMs);
            }
        }
    }

    private String resolveOperation(InvocationContext ctx) {
        Instrumented methodAnnotation = ctx.getMethod().getAnnotation(Instrumented.class);
        if (methodAnnotation != null && !methodAnnotation.operation().isEmpty()) {
            return methodAnnotation.operation();
        }

        Instrumented classAnnotation = ctx.getMethod().getDeclaringClass().getAnnotation(Instrumented.class);
        if (classAnnotation != null && !classAnnotation.operation().isEmpty()) {
            return classAnnotation.operation();
        }
        return ctx.getMethod().getName();
    }

    // Handlers take the record type as their first argument
    private String resolveRecord(InvocationContext ctx) {
        Object[] parameters = ctx.getParameters();
        if (parameters.length > 0 && parameters[0] instanceof Class<?> recordType) {
            return recordType.getSimpleName();
        }
        return "unknown";
    }

    private String classifyOutcome(Object returned) {
        boolean successful = true;
        if (returned instanceof CommandResult commandResult) {
            successful = commandResult.successful();
        } else if (returned instanceof ItemQueryResult<?> itemResult) {
            successful = itemResult.successful();
        } else if (returned instanceof ListQueryResult<?> listResult) {
            successful = listResult.successful();
        }
        return successful ? "success" : "failure";
    }

    private String classifyError(Exception e) {
        String name = e.getClass().getSimpleName();
        if (name.contains("DataPipeline")) {
            return "pipeline";
        }
        if (name.contains("Constraint") || name.contains("Duplicate")) {
            return "constraint";
        }
        if (name.contains("Timeout")) {
            return "timeout";
        }
        if (name.contains("Connection")) {
            return "connection";
        }
        return "internal";
    }
}
