package tech.databroker.platform.common;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import org.hibernate.FlushMode;
import org.hibernate.Session;
import org.jboss.logging.Logger;

import java.util.function.Function;

/**
 * JTA implementation of {@link UnitOfWork}.
 *
 * <p>Each call runs in a new transaction started with {@link QuarkusTransaction#requiringNew()},
 * so the injected transaction-scoped {@link EntityManager} is bound to a fresh
 * persistence context for the duration of the call. Any transaction already active on
 * the calling thread is suspended.
 */
@ApplicationScoped
public class TransactionalUnitOfWork implements UnitOfWork {

    private static final Logger LOG = Logger.getLogger(TransactionalUnitOfWork.class);

    @Inject
    EntityManager em;

    @Override
    public <R> R read(Function<EntityManager, R> work) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Session session = em.unwrap(Session.class);
            session.setDefaultReadOnly(true);
            session.setHibernateFlushMode(FlushMode.MANUAL);
            return work.apply(em);
        });
    }

    @Override
    public <R> R write(Function<EntityManager, R> work) {
        return QuarkusTransaction.requiringNew().call(() -> {
            R result = work.apply(em);
            LOG.tracef("Unit of work complete, committing");
            return result;
        });
    }
}
