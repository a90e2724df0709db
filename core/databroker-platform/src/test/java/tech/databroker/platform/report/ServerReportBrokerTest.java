package tech.databroker.platform.report;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.databroker.core.DataPipelineException;
import tech.databroker.core.report.NamedReportRequest;
import tech.databroker.core.report.ReportBroker;
import tech.databroker.core.result.ListQueryResult;
import tech.databroker.platform.weather.WeatherForecast;
import tech.databroker.platform.weather.WeatherForecastConstants;
import tech.databroker.platform.weather.report.WeatherForecastsFilteredBySummaryRequest;
import tech.databroker.platform.weather.testdata.WeatherTestDataProvider;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("integration")
@QuarkusTest
class ServerReportBrokerTest {

    @Inject
    ReportBroker reportBroker;

    @Inject
    WeatherTestDataProvider testData;

    @BeforeEach
    void resetDatabase() {
        testData.loadDatabase();
    }

    @Test
    @DisplayName("report should return only forecasts with the requested summary")
    void getReport_shouldFilterBySummary() {
        WeatherForecastsFilteredBySummaryRequest request = WeatherForecastsFilteredBySummaryRequest.forSummary("Balmy");

        ListQueryResult<WeatherForecast> result = reportBroker.getReport(WeatherForecast.class, request);

        List<WeatherForecast> expected = testData.forecasts(forecast -> "Balmy".equals(forecast.summary));
        assertThat(result.successful()).isTrue();
        assertThat(result.totalCount()).isEqualTo(expected.size());
        assertThat(result.items()).containsExactlyInAnyOrderElementsOf(expected);
    }

    @Test
    @DisplayName("report should page and sort its rows")
    void getReport_shouldPageAndSort() {
        WeatherForecastsFilteredBySummaryRequest request = WeatherForecastsFilteredBySummaryRequest.forSummary("Hot")
            .sortedBy(WeatherForecastConstants.DATE, true)
            .page(2, 3);

        ListQueryResult<WeatherForecast> result = reportBroker.getReport(WeatherForecast.class, request);

        List<WeatherForecast> expected = testData.forecasts(forecast -> "Hot".equals(forecast.summary)).stream()
            .sorted((a, b) -> b.date.compareTo(a.date))
            .skip(2)
            .limit(3)
            .toList();
        assertThat(result.items()).containsExactlyElementsOf(expected);
        assertThat(result.totalCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("report should ignore the start index when paging is disabled")
    void getReport_shouldReturnAll_whenUnpagedWithStartIndex() {
        WeatherForecastsFilteredBySummaryRequest request = WeatherForecastsFilteredBySummaryRequest.forSummary(null)
            .page(10, 0);

        ListQueryResult<WeatherForecast> result = reportBroker.getReport(WeatherForecast.class, request);

        assertThat(result.successful()).isTrue();
        assertThat(result.items()).hasSize(testData.count());
        assertThat(result.totalCount()).isEqualTo(testData.count());
    }

    @Test
    @DisplayName("report without a summary should return every forecast")
    void getReport_shouldReturnAll_whenSummaryEmpty() {
        ListQueryResult<WeatherForecast> result = reportBroker.getReport(
            WeatherForecast.class, WeatherForecastsFilteredBySummaryRequest.forSummary(null));

        assertThat(result.totalCount()).isEqualTo(testData.count());
    }

    @Test
    @DisplayName("unknown report should give a failure result")
    void getReport_shouldFail_whenNoHandlerRegistered() {
        NamedReportRequest request = NamedReportRequest.of("RainfallByMonth");

        ListQueryResult<WeatherForecast> result = reportBroker.getReport(WeatherForecast.class, request);

        assertThat(result.successful()).isFalse();
        assertThat(result.items()).isEmpty();
        assertThat(result.message())
            .isEqualTo("A report for " + NamedReportRequest.class.getName() + " is not defined in the services container.");
    }

    @Test
    @DisplayName("report name matched to a handler for another request type should fail")
    void getReport_shouldFail_whenRequestTypeDoesNotMatchHandler() {
        NamedReportRequest request = NamedReportRequest.of(WeatherForecastConstants.FILTERED_BY_SUMMARY_REPORT);

        ListQueryResult<WeatherForecast> result = reportBroker.getReport(WeatherForecast.class, request);

        assertThat(result.successful()).isFalse();
    }

    @Test
    @DisplayName("report requested for another record type should fail")
    void getReport_shouldFail_whenRecordTypeDoesNotMatch() {
        ListQueryResult<String> result = reportBroker.getReport(
            String.class, WeatherForecastsFilteredBySummaryRequest.forSummary("Balmy"));

        assertThat(result.successful()).isFalse();
    }

    @Test
    @DisplayName("report without a request should be a pipeline error")
    void getReport_shouldThrow_whenRequestMissing() {
        assertThatThrownBy(() -> reportBroker.getReport(WeatherForecast.class, null))
            .isInstanceOf(DataPipelineException.class);
    }
}
