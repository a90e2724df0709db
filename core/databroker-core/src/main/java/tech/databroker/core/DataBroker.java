package tech.databroker.core;

import tech.databroker.core.request.CommandRequest;
import tech.databroker.core.request.ItemQueryRequest;
import tech.databroker.core.request.ListQueryRequest;
import tech.databroker.core.result.CommandResult;
import tech.databroker.core.result.ItemQueryResult;
import tech.databroker.core.result.ListQueryResult;

/**
 * Facade over the per-operation request handlers.
 *
 * <p>Queries return data, commands return status only. Every method takes the record
 * type so the broker can route the request to a record-specific handler when one is
 * registered.
 *
 * <p>Usage:
 * <pre>{@code
 * ListQueryResult<WeatherForecast> page = dataBroker.getItems(
 *     WeatherForecast.class, ListQueryRequest.builder().pageSize(20).build());
 *
 * CommandResult saved = dataBroker.updateItem(WeatherForecast.class, CommandRequest.of(forecast));
 * if (!saved.successful()) {
 *     // saved.message() describes the failure
 * }
 * }</pre>
 */
public interface DataBroker {

    <T> ListQueryResult<T> getItems(Class<T> recordType, ListQueryRequest request);

    <T> ItemQueryResult<T> getItem(Class<T> recordType, ItemQueryRequest request);

    <T> CommandResult createItem(Class<T> recordType, CommandRequest<T> request);

    <T> CommandResult updateItem(Class<T> recordType, CommandRequest<T> request);

    <T> CommandResult deleteItem(Class<T> recordType, CommandRequest<T> request);
}
