package tech.databroker.platform.weather.service;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.databroker.core.DataBroker;
import tech.databroker.core.request.CommandRequest;
import tech.databroker.core.request.ItemQueryRequest;
import tech.databroker.core.result.CommandResult;
import tech.databroker.core.result.ItemQueryResult;
import tech.databroker.platform.weather.WeatherForecast;
import tech.databroker.platform.weather.WeatherForecastEditContext;

import java.util.UUID;

/**
 * Loads one forecast into a {@link WeatherForecastEditContext} and saves the edits.
 */
@Dependent
public class WeatherForecastEditService {

    private static final Logger LOG = Logger.getLogger(WeatherForecastEditService.class);

    @Inject
    DataBroker dataBroker;

    private final WeatherForecastEditContext editContext = new WeatherForecastEditContext(new WeatherForecast());
    private CommandResult lastResult = CommandResult.success();

    public WeatherForecastEditContext editContext() {
        return editContext;
    }

    public CommandResult lastResult() {
        return lastResult;
    }

    /**
     * Load the forecast with {@code uid}. The edit context is left unchanged if it is not found.
     */
    public ItemQueryResult<WeatherForecast> loadForecast(UUID uid) {
        ItemQueryResult<WeatherForecast> result = dataBroker.getItem(WeatherForecast.class, ItemQueryRequest.of(uid));
        if (result.successful()) {
            editContext.load(result.item(), true);
        } else {
            LOG.warnf("Could not load forecast %s: %s", uid, result.message());
        }
        return result;
    }

    /**
     * Start editing a forecast that is not stored yet.
     */
    public void newForecast() {
        editContext.load(new WeatherForecast(), true);
    }

    /**
     * Save the edits. A clean context is not written. A new forecast is created with a
     * fresh Uid; an existing one is updated.
     */
    public CommandResult saveForecast() {
        if (!editContext.isDirty()) {
            return lastResult;
        }

        WeatherForecast record = editContext.isNew() ? editContext.asNewRecord() : editContext.record();
        CommandResult result = editContext.isNew()
            ? dataBroker.createItem(WeatherForecast.class, CommandRequest.of(record))
            : dataBroker.updateItem(WeatherForecast.class, CommandRequest.of(record));

        if (result.successful()) {
            editContext.load(record, true);
        }
        lastResult = result;
        return result;
    }
}
