package tech.databroker.platform.weather.report;

import tech.databroker.core.report.ReportRequest;
import tech.databroker.platform.weather.WeatherForecastConstants;

import java.util.Optional;

/**
 * Report of the forecasts with a given summary. An empty summary reports every forecast.
 */
public record WeatherForecastsFilteredBySummaryRequest(
    String reportName,
    Optional<String> summary,
    int startIndex,
    int pageSize,
    Optional<String> sortField,
    boolean sortDescending
) implements ReportRequest {

    public WeatherForecastsFilteredBySummaryRequest {
        if (reportName == null || reportName.isBlank()) {
            reportName = WeatherForecastConstants.FILTERED_BY_SUMMARY_REPORT;
        }
        if (startIndex < 0 || pageSize < 0) {
            throw new IllegalArgumentException("Start index and page size cannot be negative");
        }
        summary = summary == null ? Optional.empty() : summary;
        sortField = sortField == null ? Optional.empty() : sortField;
    }

    public static WeatherForecastsFilteredBySummaryRequest forSummary(String summary) {
        return new WeatherForecastsFilteredBySummaryRequest(
            WeatherForecastConstants.FILTERED_BY_SUMMARY_REPORT,
            Optional.ofNullable(summary),
            0,
            DEFAULT_PAGE_SIZE,
            Optional.empty(),
            false);
    }

    public WeatherForecastsFilteredBySummaryRequest sortedBy(String field, boolean descending) {
        return new WeatherForecastsFilteredBySummaryRequest(
            reportName, summary, startIndex, pageSize, Optional.ofNullable(field), descending);
    }

    public WeatherForecastsFilteredBySummaryRequest page(int start, int size) {
        return new WeatherForecastsFilteredBySummaryRequest(
            reportName, summary, start, size, sortField, sortDescending);
    }
}
