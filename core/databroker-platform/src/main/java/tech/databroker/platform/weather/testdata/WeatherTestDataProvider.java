package tech.databroker.platform.weather.testdata;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.databroker.platform.config.DataBrokerConfig;
import tech.databroker.platform.weather.WeatherForecast;
import tech.databroker.platform.weather.panache.WeatherForecastRepository;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Deterministic sample weather forecasts.
 *
 * <p>The generated set depends only on {@code databroker.test-data.record-count}, so it
 * doubles as the control data tests compare broker results against. Summaries cycle
 * through {@link #SUMMARIES}; every tenth record shares a summary.
 */
@ApplicationScoped
public class WeatherTestDataProvider {

    private static final Logger LOG = Logger.getLogger(WeatherTestDataProvider.class);

    public static final List<String> SUMMARIES = List.of(
        "Freezing", "Bracing", "Chilly", "Cool", "Mild", "Warm", "Balmy", "Hot", "Sweltering", "Scorching");

    static final LocalDate FIRST_DATE = LocalDate.of(2024, 1, 1);

    @Inject
    DataBrokerConfig config;

    @Inject
    WeatherForecastRepository repository;

    private volatile List<WeatherForecast> forecasts;

    /**
     * Drop all stored forecasts and insert the sample set.
     */
    @Transactional
    public void loadDatabase() {
        List<WeatherForecast> copies = new ArrayList<>();
        for (WeatherForecast forecast : forecasts()) {
            copies.add(forecast.copy());
        }
        repository.replaceAll(copies);
        LOG.infof("Loaded %d sample weather forecasts", copies.size());
    }

    /**
     * The sample set. Returned records are copies and may be modified freely.
     */
    public List<WeatherForecast> forecasts() {
        List<WeatherForecast> copies = new ArrayList<>();
        for (WeatherForecast forecast : generated()) {
            copies.add(forecast.copy());
        }
        return copies;
    }

    public List<WeatherForecast> forecasts(Predicate<WeatherForecast> filter) {
        return forecasts().stream().filter(filter).toList();
    }

    public int count() {
        return generated().size();
    }

    public WeatherForecast randomRecord() {
        List<WeatherForecast> generated = generated();
        return generated.get(ThreadLocalRandom.current().nextInt(generated.size())).copy();
    }

    private List<WeatherForecast> generated() {
        List<WeatherForecast> current = forecasts;
        if (current == null) {
            current = generate(config.testData().recordCount());
            forecasts = current;
        }
        return current;
    }

    static List<WeatherForecast> generate(int count) {
        List<WeatherForecast> generated = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            generated.add(new WeatherForecast(
                UUID.nameUUIDFromBytes(("weather-forecast-" + i).getBytes(StandardCharsets.UTF_8)),
                FIRST_DATE.plusDays(i),
                -20 + (i * 7) % 75,
                SUMMARIES.get(i % SUMMARIES.size())));
        }
        return Collections.unmodifiableList(generated);
    }
}
