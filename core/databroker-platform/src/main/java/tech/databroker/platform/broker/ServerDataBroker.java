package tech.databroker.platform.broker;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.databroker.core.DataBroker;
import tech.databroker.core.handler.CreateRequestHandler;
import tech.databroker.core.handler.DeleteRequestHandler;
import tech.databroker.core.handler.ItemRequestHandler;
import tech.databroker.core.handler.ListRequestHandler;
import tech.databroker.core.handler.UpdateRequestHandler;
import tech.databroker.core.request.CommandRequest;
import tech.databroker.core.request.ItemQueryRequest;
import tech.databroker.core.request.ListQueryRequest;
import tech.databroker.core.result.CommandResult;
import tech.databroker.core.result.ItemQueryResult;
import tech.databroker.core.result.ListQueryResult;

/**
 * In-process {@link DataBroker} that hands each request to the registered handler.
 */
@ApplicationScoped
public class ServerDataBroker implements DataBroker {

    @Inject
    ListRequestHandler listRequestHandler;

    @Inject
    ItemRequestHandler itemRequestHandler;

    @Inject
    CreateRequestHandler createRequestHandler;

    @Inject
    UpdateRequestHandler updateRequestHandler;

    @Inject
    DeleteRequestHandler deleteRequestHandler;

    @Override
    public <T> ListQueryResult<T> getItems(Class<T> recordType, ListQueryRequest request) {
        return listRequestHandler.execute(recordType, request);
    }

    @Override
    public <T> ItemQueryResult<T> getItem(Class<T> recordType, ItemQueryRequest request) {
        return itemRequestHandler.execute(recordType, request);
    }

    @Override
    public <T> CommandResult createItem(Class<T> recordType, CommandRequest<T> request) {
        return createRequestHandler.execute(recordType, request);
    }

    @Override
    public <T> CommandResult updateItem(Class<T> recordType, CommandRequest<T> request) {
        return updateRequestHandler.execute(recordType, request);
    }

    @Override
    public <T> CommandResult deleteItem(Class<T> recordType, CommandRequest<T> request) {
        return deleteRequestHandler.execute(recordType, request);
    }
}
