package tech.databroker.core.handler;

import tech.databroker.core.RecordTyped;
import tech.databroker.core.request.ListQueryRequest;
import tech.databroker.core.result.ListQueryResult;

/**
 * Record-specific list handler.
 *
 * <p>When a bean of this type is registered for a record type, list queries for that
 * type are routed to it instead of the generic {@link ListRequestHandler}. Use it when
 * a record needs a query the generic pipeline cannot express, such as a join or a
 * projection.
 *
 * @param <T> the record type
 */
public interface RecordListRequestHandler<T> extends RecordTyped<T> {

    ListQueryResult<T> execute(ListQueryRequest request);
}
