package tech.databroker.platform.handler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.databroker.core.DataPipelineException;
import tech.databroker.core.request.CommandRequest;
import tech.databroker.core.result.CommandResult;
import tech.databroker.platform.common.UnitOfWork;
import tech.databroker.platform.shared.Instrumented;

import java.util.Optional;

/**
 * Generic update: copies the state of the detached item onto the stored record with the
 * same identifier. Fails without writing when no such record exists.
 */
@ApplicationScoped
@Instrumented(operation = "update")
public class UpdateRequestBaseServerHandler {

    private static final Logger LOG = Logger.getLogger(UpdateRequestBaseServerHandler.class);

    static final String SUCCESS_MESSAGE = "Record Saved";
    static final String FAILURE_MESSAGE = "Error saving Record";

    @Inject
    UnitOfWork unitOfWork;

    public <T> CommandResult execute(Class<T> recordType, CommandRequest<T> request) {
        if (request == null) {
            throw new DataPipelineException("No CommandRequest defined in " + getClass().getName());
        }

        try {
            int updated = unitOfWork.write(em -> {
                Optional<Object> id = EntityIdentity.idOf(em, request.item());
                if (id.isEmpty() || em.find(recordType, id.get()) == null) {
                    return 0;
                }
                em.merge(request.item());
                em.flush();
                return 1;
            });
            if (updated == 1) {
                return CommandResult.success(SUCCESS_MESSAGE);
            }
            LOG.errorf("Failed to update %s record, %d records changed", recordType.getSimpleName(), updated);
            return CommandResult.failure(FAILURE_MESSAGE);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error updating %s record", recordType.getSimpleName());
            return CommandResult.failure(FAILURE_MESSAGE);
        }
    }
}
