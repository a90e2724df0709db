package tech.databroker.platform.weather;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import tech.databroker.core.DataPipelineException;
import tech.databroker.core.query.RecordFilter;
import tech.databroker.core.request.FilterDefinition;

import java.util.Optional;

/**
 * Named filters for weather forecasts.
 *
 * <ul>
 *   <li>{@code BySummary}: summary equals the filter data</li>
 *   <li>{@code ByTemperature}: temperature in Celsius equals the filter data</li>
 *   <li>{@code TemperatureLessThan}: temperature in Celsius below the filter data</li>
 * </ul>
 */
@ApplicationScoped
public class WeatherForecastFilter implements RecordFilter<WeatherForecast> {

    @Override
    public Class<WeatherForecast> recordType() {
        return WeatherForecast.class;
    }

    @Override
    public Optional<Predicate> toPredicate(FilterDefinition filter, CriteriaBuilder cb, Root<WeatherForecast> root) {
        return switch (filter.filterName()) {
            case WeatherForecastConstants.BY_SUMMARY ->
                Optional.of(cb.equal(root.get(WeatherForecastConstants.SUMMARY), filter.filterData()));
            case WeatherForecastConstants.BY_TEMPERATURE ->
                Optional.of(cb.equal(root.get(WeatherForecastConstants.TEMPERATURE_C), temperature(filter)));
            case WeatherForecastConstants.TEMPERATURE_LESS_THAN ->
                Optional.of(cb.lessThan(root.<Integer>get(WeatherForecastConstants.TEMPERATURE_C), temperature(filter)));
            default -> Optional.empty();
        };
    }

    private static Integer temperature(FilterDefinition filter) {
        try {
            return Integer.valueOf(filter.filterData().trim());
        } catch (NumberFormatException e) {
            throw new DataPipelineException(
                "Filter " + filter.filterName() + " expects a whole number of degrees, got '"
                    + filter.filterData() + "'", e);
        }
    }
}
