package tech.databroker.platform.handler;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.databroker.core.DataPipelineException;
import tech.databroker.core.RecordTyped;
import tech.databroker.core.handler.ListRequestHandler;
import tech.databroker.core.handler.RecordListRequestHandler;
import tech.databroker.core.request.ListQueryRequest;
import tech.databroker.core.result.ListQueryResult;

import java.util.Optional;

/**
 * Routes list queries to the {@link RecordListRequestHandler} registered for the record
 * type, or to {@link ListRequestBaseServerHandler} when there is none.
 *
 * <p>Declared as a default bean: an application can replace the routing as a whole by
 * registering its own {@link ListRequestHandler}.
 */
@DefaultBean
@ApplicationScoped
public class ListRequestServerHandler implements ListRequestHandler {

    private static final Logger LOG = Logger.getLogger(ListRequestServerHandler.class);

    @Inject
    Instance<RecordListRequestHandler<?>> recordHandlers;

    @Inject
    ListRequestBaseServerHandler baseHandler;

    @Override
    @SuppressWarnings("unchecked")
    public <T> ListQueryResult<T> execute(Class<T> recordType, ListQueryRequest request) {
        if (request == null) {
            throw new DataPipelineException("No ListQueryRequest defined in " + getClass().getName());
        }

        Optional<RecordListRequestHandler<?>> recordHandler = RecordTyped.select(recordHandlers, recordType);
        if (recordHandler.isPresent()) {
            LOG.debugf("Routing %s list query to %s",
                recordType.getSimpleName(), recordHandler.get().getClass().getName());
            return ((RecordListRequestHandler<T>) recordHandler.get()).execute(request);
        }
        return baseHandler.execute(recordType, request);
    }
}
