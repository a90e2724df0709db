package tech.databroker.platform.handler;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.databroker.core.DataPipelineException;
import tech.databroker.core.RecordTyped;
import tech.databroker.core.handler.ItemRequestHandler;
import tech.databroker.core.handler.RecordItemRequestHandler;
import tech.databroker.core.request.ItemQueryRequest;
import tech.databroker.core.result.ItemQueryResult;

import java.util.Optional;

/**
 * Routes item queries to a {@link RecordItemRequestHandler} or to
 * {@link ItemRequestBaseServerHandler}.
 */
@DefaultBean
@ApplicationScoped
public class ItemRequestServerHandler implements ItemRequestHandler {

    private static final Logger LOG = Logger.getLogger(ItemRequestServerHandler.class);

    @Inject
    Instance<RecordItemRequestHandler<?>> recordHandlers;

    @Inject
    ItemRequestBaseServerHandler baseHandler;

    @Override
    @SuppressWarnings("unchecked")
    public <T> ItemQueryResult<T> execute(Class<T> recordType, ItemQueryRequest request) {
        if (request == null) {
            throw new DataPipelineException("No ItemQueryRequest defined in " + getClass().getName());
        }

        Optional<RecordItemRequestHandler<?>> recordHandler = RecordTyped.select(recordHandlers, recordType);
        if (recordHandler.isPresent()) {
            LOG.debugf("Routing %s item query to %s",
                recordType.getSimpleName(), recordHandler.get().getClass().getName());
            return ((RecordItemRequestHandler<T>) recordHandler.get()).execute(request);
        }
        return baseHandler.execute(recordType, request);
    }
}
