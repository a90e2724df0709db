package tech.databroker.platform.weather.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.databroker.platform.weather.WeatherForecast;

import java.util.List;
import java.util.UUID;

/**
 * Bulk repository for weather forecasts, used to seed and reset the sample data.
 * Callers must run inside a transaction.
 */
@ApplicationScoped
public class WeatherForecastRepository implements PanacheRepositoryBase<WeatherForecast, UUID> {

    /**
     * Replace every stored forecast with {@code forecasts}.
     */
    public void replaceAll(List<WeatherForecast> forecasts) {
        deleteAll();
        persist(forecasts);
        flush();
    }
}
