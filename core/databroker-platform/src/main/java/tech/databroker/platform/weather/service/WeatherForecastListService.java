package tech.databroker.platform.weather.service;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import tech.databroker.core.DataBroker;
import tech.databroker.core.request.ListQueryRequest;
import tech.databroker.core.result.ListQueryResult;
import tech.databroker.core.result.OffsetPage;
import tech.databroker.platform.weather.WeatherForecast;

import java.util.List;

/**
 * Holds the forecast list a view is showing.
 */
@Dependent
public class WeatherForecastListService {

    @Inject
    DataBroker dataBroker;

    private List<WeatherForecast> forecasts = List.of();
    private long totalCount;

    /**
     * Load the forecasts matching {@code request}. The held list is only replaced when
     * the query succeeds.
     */
    public ListQueryResult<WeatherForecast> loadForecasts(ListQueryRequest request) {
        ListQueryResult<WeatherForecast> result = dataBroker.getItems(WeatherForecast.class, request);
        if (result.successful()) {
            forecasts = result.items();
            totalCount = result.totalCount();
        }
        return result;
    }

    /**
     * One window of forecasts for a virtualized view.
     */
    public OffsetPage<WeatherForecast> getForecastPage(int startIndex, int count) {
        ListQueryRequest request = ListQueryRequest.builder()
            .startIndex(startIndex)
            .pageSize(count)
            .build();
        return OffsetPage.of(request, dataBroker.getItems(WeatherForecast.class, request));
    }

    public List<WeatherForecast> forecasts() {
        return forecasts;
    }

    public long totalCount() {
        return totalCount;
    }
}
