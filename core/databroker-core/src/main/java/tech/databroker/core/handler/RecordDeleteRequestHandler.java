package tech.databroker.core.handler;

import tech.databroker.core.RecordTyped;
import tech.databroker.core.request.CommandRequest;
import tech.databroker.core.result.CommandResult;

/**
 * Record-specific delete handler, e.g. for records that are soft-deleted or own child rows.
 *
 * @param <T> the record type
 */
public interface RecordDeleteRequestHandler<T> extends RecordTyped<T> {

    CommandResult execute(CommandRequest<T> request);
}
