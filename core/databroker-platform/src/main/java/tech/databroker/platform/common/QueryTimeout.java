package tech.databroker.platform.common;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.TypedQuery;
import tech.databroker.platform.config.DataBrokerConfig;

/**
 * Applies {@code databroker.query-timeout} to JPA queries.
 */
@ApplicationScoped
public class QueryTimeout {

    static final String TIMEOUT_HINT = "jakarta.persistence.query.timeout";

    @Inject
    DataBrokerConfig config;

    public <T> TypedQuery<T> apply(TypedQuery<T> query) {
        config.queryTimeout()
            .ifPresent(timeout -> query.setHint(TIMEOUT_HINT, Math.toIntExact(timeout.toMillis())));
        return query;
    }
}
