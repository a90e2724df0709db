package tech.databroker.core.handler;

import tech.databroker.core.RecordTyped;
import tech.databroker.core.request.CommandRequest;
import tech.databroker.core.result.CommandResult;

/**
 * Record-specific update handler. When a bean of this type is registered for a record
 * type it replaces the generic {@link UpdateRequestHandler} for that type.
 *
 * @param <T> the record type
 */
public interface RecordUpdateRequestHandler<T> extends RecordTyped<T> {

    CommandResult execute(CommandRequest<T> request);
}
