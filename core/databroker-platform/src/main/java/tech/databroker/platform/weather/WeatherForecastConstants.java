package tech.databroker.platform.weather;

/**
 * Field, filter and report names for weather forecasts.
 */
public final class WeatherForecastConstants {

    public static final String UID = "uid";
    public static final String DATE = "date";
    public static final String TEMPERATURE_C = "temperatureC";
    public static final String SUMMARY = "summary";

    public static final String BY_SUMMARY = "BySummary";
    public static final String BY_TEMPERATURE = "ByTemperature";
    public static final String TEMPERATURE_LESS_THAN = "TemperatureLessThan";

    public static final String FILTERED_BY_SUMMARY_REPORT = "WeatherForecastsFilteredBySummary";

    private WeatherForecastConstants() {
    }
}
