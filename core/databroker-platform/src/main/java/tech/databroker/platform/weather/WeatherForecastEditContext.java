package tech.databroker.platform.weather;

import tech.databroker.core.edit.RecordEditContextBase;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Edit context for a {@link WeatherForecast}.
 */
public class WeatherForecastEditContext extends RecordEditContextBase<WeatherForecast> {

    private LocalDate date;
    private int temperatureC;
    private String summary;

    public WeatherForecastEditContext(WeatherForecast record) {
        load(record, false);
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate value) {
        updateIfChangedAndNotify(date, value, v -> date = v, WeatherForecastConstants.DATE);
    }

    public int getTemperatureC() {
        return temperatureC;
    }

    public void setTemperatureC(int value) {
        updateIfChangedAndNotify(temperatureC, value, v -> temperatureC = v, WeatherForecastConstants.TEMPERATURE_C);
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String value) {
        updateIfChangedAndNotify(summary, value, v -> summary = v, WeatherForecastConstants.SUMMARY);
    }

    @Override
    public WeatherForecast record() {
        return new WeatherForecast(uid, date, temperatureC, summary);
    }

    @Override
    public WeatherForecast asNewRecord() {
        return new WeatherForecast(UUID.randomUUID(), date, temperatureC, summary);
    }

    @Override
    public void load(WeatherForecast record, boolean notify) {
        WeatherForecast source = record != null ? record : new WeatherForecast();
        baseRecord = source.copy();
        uid = source.uid;
        date = source.date;
        temperatureC = source.temperatureC;
        summary = source.summary;

        if (notify) {
            notifyEditStateChanged();
        }
    }
}
