package tech.databroker.platform.handler;

import jakarta.persistence.EntityManager;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.SingularAttribute;
import tech.databroker.core.DataPipelineException;

import java.util.Optional;

/**
 * Reads entity identity from the persistence metamodel.
 */
final class EntityIdentity {

    private EntityIdentity() {
    }

    /**
     * Identifier value of {@code entity}, empty if it has none yet.
     */
    static Optional<Object> idOf(EntityManager em, Object entity) {
        return Optional.ofNullable(
            em.getEntityManagerFactory().getPersistenceUnitUtil().getIdentifier(entity));
    }

    /**
     * Name of the single identifier attribute of {@code recordType}.
     *
     * @throws DataPipelineException if the type has no single identifier attribute
     */
    static String idAttribute(EntityManager em, Class<?> recordType) {
        EntityType<?> entityType = em.getMetamodel().entity(recordType);
        for (SingularAttribute<?, ?> attribute : entityType.getSingularAttributes()) {
            if (attribute.isId()) {
                return attribute.getName();
            }
        }
        throw new DataPipelineException(
            recordType.getName() + " does not declare a single identifier attribute");
    }
}
