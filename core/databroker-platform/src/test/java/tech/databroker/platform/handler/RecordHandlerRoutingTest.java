package tech.databroker.platform.handler;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.databroker.core.DataBroker;
import tech.databroker.core.request.ListQueryRequest;
import tech.databroker.core.result.ListQueryResult;
import tech.databroker.platform.weather.WeatherForecast;
import tech.databroker.platform.weather.testdata.WeatherTestDataProvider;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for routing to record-specific handlers registered as beans.
 */
@Tag("integration")
@QuarkusTest
class RecordHandlerRoutingTest {

    @Inject
    DataBroker broker;

    @Inject
    WeatherTestDataProvider testData;

    @BeforeEach
    void resetDatabase() {
        testData.loadDatabase();
    }

    @Test
    @DisplayName("list query should be routed to the registered record-specific handler")
    void getItems_shouldUseRegisteredRecordHandler() {
        ListQueryResult<WeatherStation> result = broker.getItems(WeatherStation.class, ListQueryRequest.defaults());

        assertThat(result.successful()).isTrue();
        assertThat(result.items()).containsExactlyElementsOf(WeatherStationListHandler.STATIONS);
        assertThat(result.totalCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("record types without a registered handler should still use the generic handler")
    void getItems_shouldUseGenericHandler_whenNoRecordHandler() {
        ListQueryResult<WeatherForecast> result = broker.getItems(WeatherForecast.class, ListQueryRequest.defaults());

        assertThat(result.successful()).isTrue();
        assertThat(result.totalCount()).isEqualTo(testData.count());
    }
}
