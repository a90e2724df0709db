package tech.databroker.platform.weather;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Root;
import tech.databroker.core.query.RecordSorterBase;

import java.util.List;

/**
 * Sorts by summary or temperature with the forecast date as tie-breaker, and binds other
 * fields by name.
 */
@ApplicationScoped
public class WeatherForecastSorter extends RecordSorterBase<WeatherForecast> {

    @Override
    public Class<WeatherForecast> recordType() {
        return WeatherForecast.class;
    }

    @Override
    public List<Order> toOrders(String sortField, boolean sortDescending, CriteriaBuilder cb, Root<WeatherForecast> root) {
        if (sortField == null || sortField.isBlank()) {
            return List.of();
        }
        return switch (sortField) {
            case WeatherForecastConstants.SUMMARY ->
                sortBy(sortDescending, cb, root, WeatherForecastConstants.SUMMARY, WeatherForecastConstants.DATE);
            case WeatherForecastConstants.TEMPERATURE_C ->
                sortBy(sortDescending, cb, root, WeatherForecastConstants.TEMPERATURE_C, WeatherForecastConstants.DATE);
            default -> sortByField(sortField, sortDescending, cb, root);
        };
    }
}
