package tech.databroker.core.report;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the report a {@link ReportHandler} produces.
 *
 * <pre>
 * {@code @ReportHandlerName("WeatherForecastsFilteredBySummary")}
 * class WeatherForecastsFilteredBySummaryHandler implements ReportHandler<...> { ... }
 * </pre>
 */
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ReportHandlerName {

    String value();
}
