package tech.databroker.core.handler;

import tech.databroker.core.request.CommandRequest;
import tech.databroker.core.result.CommandResult;

/**
 * Handles update commands for any record type.
 */
public interface UpdateRequestHandler {

    <T> CommandResult execute(Class<T> recordType, CommandRequest<T> request);
}
