package tech.databroker.core.handler;

import tech.databroker.core.request.ItemQueryRequest;
import tech.databroker.core.result.ItemQueryResult;

/**
 * Handles single record queries for any record type.
 */
public interface ItemRequestHandler {

    <T> ItemQueryResult<T> execute(Class<T> recordType, ItemQueryRequest request);
}
