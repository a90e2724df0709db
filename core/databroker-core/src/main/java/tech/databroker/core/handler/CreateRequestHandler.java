package tech.databroker.core.handler;

import tech.databroker.core.request.CommandRequest;
import tech.databroker.core.result.CommandResult;

/**
 * Handles create commands for any record type.
 */
public interface CreateRequestHandler {

    <T> CommandResult execute(Class<T> recordType, CommandRequest<T> request);
}
