package tech.databroker.core.request;

import tech.databroker.core.DataPipelineException;

/**
 * Command carrying the record to create, update or delete.
 *
 * @param item The record the command applies to
 * @param <T>  The record type
 */
public record CommandRequest<T>(
    T item
) {
    public CommandRequest {
        if (item == null) {
            throw new DataPipelineException("No Item provided for the CommandRequest");
        }
    }

    public static <T> CommandRequest<T> of(T item) {
        return new CommandRequest<>(item);
    }
}
