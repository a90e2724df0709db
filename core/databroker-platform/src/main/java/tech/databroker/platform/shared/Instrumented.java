package tech.databroker.platform.shared;

import jakarta.enterprise.util.Nonbinding;
import jakarta.interceptor.InterceptorBinding;
import java.lang.annotation.*;

/**
 * Marks a handler class for automatic metrics instrumentation.
 * Records duration, count, and errors via Micrometer.
 *
 * Usage:
 * <pre>
 * {@code @Instrumented(operation = "list")}
 * class ListRequestBaseServerHandler { ... }
 * </pre>
 *
 * Metrics produced:
 * - databroker_handler_duration_seconds (histogram)
 * - databroker_handler_operations_total (counter)
 * - databroker_handler_errors_total (counter)
 */
@Inherited
@InterceptorBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface Instrumented {

    /**
     * Override operation name for metrics.
     * If empty, the invoked method name is used.
     */
    @Nonbinding
    String operation() default "";
}
