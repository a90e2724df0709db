package tech.databroker.platform.handler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaDelete;
import jakarta.persistence.criteria.Root;
import org.jboss.logging.Logger;
import tech.databroker.core.DataPipelineException;
import tech.databroker.core.request.CommandRequest;
import tech.databroker.core.result.CommandResult;
import tech.databroker.platform.common.UnitOfWork;
import tech.databroker.platform.shared.Instrumented;

import java.util.Optional;

/**
 * Generic delete by identifier. Only the item's identifier is read; the rest of its
 * state may differ from the stored record.
 */
@ApplicationScoped
@Instrumented(operation = "delete")
public class DeleteRequestBaseServerHandler {

    private static final Logger LOG = Logger.getLogger(DeleteRequestBaseServerHandler.class);

    static final String SUCCESS_MESSAGE = "Record Deleted";
    static final String FAILURE_MESSAGE = "Error deleting Record";

    @Inject
    UnitOfWork unitOfWork;

    public <T> CommandResult execute(Class<T> recordType, CommandRequest<T> request) {
        if (request == null) {
            throw new DataPipelineException("No CommandRequest defined in " + getClass().getName());
        }

        try {
            int deleted = unitOfWork.write(em -> {
                Optional<Object> id = EntityIdentity.idOf(em, request.item());
                if (id.isEmpty()) {
                    return 0;
                }
                CriteriaBuilder cb = em.getCriteriaBuilder();
                CriteriaDelete<T> delete = cb.createCriteriaDelete(recordType);
                Root<T> root = delete.from(recordType);
                delete.where(cb.equal(root.get(EntityIdentity.idAttribute(em, recordType)), id.get()));
                return em.createQuery(delete).executeUpdate();
            });
            if (deleted == 1) {
                return CommandResult.success(SUCCESS_MESSAGE);
            }
            LOG.errorf("Failed to delete %s record, %d records changed", recordType.getSimpleName(), deleted);
            return CommandResult.failure(FAILURE_MESSAGE);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error deleting %s record", recordType.getSimpleName());
            return CommandResult.failure(FAILURE_MESSAGE);
        }
    }
}
