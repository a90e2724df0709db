package tech.databroker.platform.handler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.databroker.core.DataPipelineException;
import tech.databroker.core.request.CommandRequest;
import tech.databroker.core.result.CommandResult;
import tech.databroker.platform.common.UnitOfWork;
import tech.databroker.platform.shared.Instrumented;

/**
 * Generic insert: persists the item and flushes so constraint violations surface here.
 */
@ApplicationScoped
@Instrumented(operation = "create")
public class CreateRequestBaseServerHandler {

    private static final Logger LOG = Logger.getLogger(CreateRequestBaseServerHandler.class);

    static final String SUCCESS_MESSAGE = "Record Created";
    static final String FAILURE_MESSAGE = "Error creating Record";

    @Inject
    UnitOfWork unitOfWork;

    public <T> CommandResult execute(Class<T> recordType, CommandRequest<T> request) {
        if (request == null) {
            throw new DataPipelineException("No CommandRequest defined in " + getClass().getName());
        }

        try {
            int created = unitOfWork.write(em -> {
                em.persist(request.item());
                em.flush();
                return 1;
            });
            if (created == 1) {
                return CommandResult.success(SUCCESS_MESSAGE);
            }
            LOG.errorf("Failed to create %s record, %d records changed", recordType.getSimpleName(), created);
            return CommandResult.failure(FAILURE_MESSAGE);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error creating %s record", recordType.getSimpleName());
            return CommandResult.failure(FAILURE_MESSAGE);
        }
    }
}
