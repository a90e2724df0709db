package tech.databroker.platform.handler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;
import org.jboss.logging.Logger;
import tech.databroker.core.DataPipelineException;
import tech.databroker.core.GuidIdentity;
import tech.databroker.core.request.ItemQueryRequest;
import tech.databroker.core.result.ItemQueryResult;
import tech.databroker.platform.common.QueryTimeout;
import tech.databroker.platform.common.UnitOfWork;
import tech.databroker.platform.shared.Instrumented;

import java.util.Optional;
import java.util.UUID;

/**
 * Generic single record query.
 *
 * <p>Records implementing {@link GuidIdentity} are looked up by their {@code uid}
 * attribute. Any other record is looked up by primary key, which must then be the Uid.
 */
@ApplicationScoped
@Instrumented(operation = "item")
public class ItemRequestBaseServerHandler {

    private static final Logger LOG = Logger.getLogger(ItemRequestBaseServerHandler.class);

    static final String NOT_FOUND_MESSAGE = "No record retrieved";

    @Inject
    UnitOfWork unitOfWork;

    @Inject
    QueryTimeout queryTimeout;

    public <T> ItemQueryResult<T> execute(Class<T> recordType, ItemQueryRequest request) {
        if (request == null) {
            throw new DataPipelineException("No ItemQueryRequest defined in " + getClass().getName());
        }

        try {
            Optional<T> record = unitOfWork.read(em -> find(em, recordType, request.uid()));
            if (record.isEmpty()) {
                LOG.warnf("%s record with Uid %s not found", recordType.getSimpleName(), request.uid());
                return ItemQueryResult.failure(NOT_FOUND_MESSAGE);
            }
            return ItemQueryResult.success(record.get());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error retrieving %s record with Uid %s", recordType.getSimpleName(), request.uid());
            return ItemQueryResult.failure(NOT_FOUND_MESSAGE + ": " + e.getMessage());
        }
    }

    private <T> Optional<T> find(EntityManager em, Class<T> recordType, UUID uid) {
        if (GuidIdentity.class.isAssignableFrom(recordType)) {
            CriteriaBuilder cb = em.getCriteriaBuilder();
            CriteriaQuery<T> query = cb.createQuery(recordType);
            Root<T> root = query.from(recordType);
            query.select(root).where(cb.equal(root.get(GuidIdentity.UID_ATTRIBUTE), uid));
            return queryTimeout.apply(em.createQuery(query))
                .setMaxResults(1)
                .getResultList()
                .stream()
                .findFirst();
        }
        return Optional.ofNullable(em.find(recordType, uid));
    }
}
