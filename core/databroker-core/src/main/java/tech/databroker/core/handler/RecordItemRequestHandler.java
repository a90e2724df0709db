package tech.databroker.core.handler;

import tech.databroker.core.RecordTyped;
import tech.databroker.core.request.ItemQueryRequest;
import tech.databroker.core.result.ItemQueryResult;

/**
 * Record-specific item handler, replacing the generic {@link ItemRequestHandler} for
 * its record type.
 *
 * @param <T> the record type
 */
public interface RecordItemRequestHandler<T> extends RecordTyped<T> {

    ItemQueryResult<T> execute(ItemQueryRequest request);
}
