package tech.databroker.core.handler;

import tech.databroker.core.request.ListQueryRequest;
import tech.databroker.core.result.ListQueryResult;

/**
 * Handles list queries for any record type.
 */
public interface ListRequestHandler {

    /**
     * Run the list pipeline (filter, count, sort, page) for {@code recordType}.
     *
     * @throws tech.databroker.core.DataPipelineException if the request is missing
     */
    <T> ListQueryResult<T> execute(Class<T> recordType, ListQueryRequest request);
}
