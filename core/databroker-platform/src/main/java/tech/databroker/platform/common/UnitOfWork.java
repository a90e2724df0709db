package tech.databroker.platform.common;

import jakarta.persistence.EntityManager;

import java.util.function.Function;

/**
 * Unit of Work for data broker operations.
 *
 * <p>Every call opens a new transaction with its own persistence context, runs the work
 * against it and closes it again. Nothing is shared between calls apart from the
 * entity manager factory and the connection pool.
 *
 * <p>Usage in a handler:
 * <pre>{@code
 * long count = unitOfWork.read(em -> em.createQuery(countQuery).getSingleResult());
 *
 * int deleted = unitOfWork.write(em -> em.createQuery(deleteQuery).executeUpdate());
 * }</pre>
 *
 * <p>Exceptions thrown by the work, or by the commit, roll the transaction back and are
 * rethrown to the caller.
 */
public interface UnitOfWork {

    /**
     * Run read-only work. Loaded entities are not tracked for changes and the
     * persistence context is never flushed.
     */
    <R> R read(Function<EntityManager, R> work);

    /**
     * Run work that changes data. Changes are committed when the work returns.
     */
    <R> R write(Function<EntityManager, R> work);
}
