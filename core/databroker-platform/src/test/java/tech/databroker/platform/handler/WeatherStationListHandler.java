package tech.databroker.platform.handler;

import jakarta.enterprise.context.ApplicationScoped;
import tech.databroker.core.handler.RecordListRequestHandler;
import tech.databroker.core.request.ListQueryRequest;
import tech.databroker.core.result.ListQueryResult;

import java.util.List;

/**
 * Record-specific list handler registered as a bean for {@link WeatherStation}.
 */
@ApplicationScoped
public class WeatherStationListHandler implements RecordListRequestHandler<WeatherStation> {

    static final List<WeatherStation> STATIONS = List.of(
        new WeatherStation("Kew Gardens", 51.48, -0.29),
        new WeatherStation("Armagh", 54.35, -6.65));

    @Override
    public Class<WeatherStation> recordType() {
        return WeatherStation.class;
    }

    @Override
    public ListQueryResult<WeatherStation> execute(ListQueryRequest request) {
        return ListQueryResult.success(STATIONS, STATIONS.size());
    }
}
