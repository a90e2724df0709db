package tech.databroker.platform.handler;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.databroker.core.DataPipelineException;
import tech.databroker.core.RecordTyped;
import tech.databroker.core.handler.CreateRequestHandler;
import tech.databroker.core.handler.RecordCreateRequestHandler;
import tech.databroker.core.request.CommandRequest;
import tech.databroker.core.result.CommandResult;

import java.util.Optional;

@DefaultBean
@ApplicationScoped
public class CreateRequestServerHandler implements CreateRequestHandler {

    private static final Logger LOG = Logger.getLogger(CreateRequestServerHandler.class);

    @Inject
    Instance<RecordCreateRequestHandler<?>> recordHandlers;

    @Inject
    CreateRequestBaseServerHandler baseHandler;

    @Override
    @SuppressWarnings("unchecked")
    public <T> CommandResult execute(Class<T> recordType, CommandRequest<T> request) {
        if (request == null) {
            throw new DataPipelineException("No CommandRequest defined in " + getClass().getName());
        }

        Optional<RecordCreateRequestHandler<?>> recordHandler = RecordTyped.select(recordHandlers, recordType);
        if (recordHandler.isPresent()) {
            LOG.debugf("Routing %s create to %s",
                recordType.getSimpleName(), recordHandler.get().getClass().getName());
            return ((RecordCreateRequestHandler<T>) recordHandler.get()).execute(request);
        }
        return baseHandler.execute(recordType, request);
    }
}
