package tech.databroker.platform.handler;

/**
 * Record type served only by {@link WeatherStationListHandler}; it has no table.
 */
public record WeatherStation(String name, double latitude, double longitude) {
}
