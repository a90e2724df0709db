package tech.databroker.platform.shared;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.databroker.core.DataBroker;
import tech.databroker.core.request.ItemQueryRequest;
import tech.databroker.core.request.ListQueryRequest;
import tech.databroker.platform.weather.WeatherForecast;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Verifies handler calls are recorded as Micrometer meters.
 */
@Tag("integration")
@QuarkusTest
class InstrumentedInterceptorTest {

    @Inject
    DataBroker broker;

    @Inject
    MeterRegistry registry;

    private double operations(String operation, String result) {
        Counter counter = registry.find("databroker.handler.operations")
            .tags("record", "WeatherForecast", "operation", operation, "result", result)
            .counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    @DisplayName("successful list query should be counted as success")
    void listQuery_shouldBeCountedAsSuccess() {
        double before = operations("list", "success");

        broker.getItems(WeatherForecast.class, ListQueryRequest.defaults());

        assertThat(operations("list", "success")).isEqualTo(before + 1);
        assertThat(registry.find("databroker.handler.duration").tags("operation", "list").timer()).isNotNull();
    }

    @Test
    @DisplayName("item query that finds nothing should be counted as failure")
    void itemQuery_shouldBeCountedAsFailure_whenNotFound() {
        double before = operations("item", "failure");

        broker.getItem(WeatherForecast.class, ItemQueryRequest.of(UUID.randomUUID()));

        assertThat(operations("item", "failure")).isEqualTo(before + 1);
    }
}
