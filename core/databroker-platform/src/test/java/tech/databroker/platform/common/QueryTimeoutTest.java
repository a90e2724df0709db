package tech.databroker.platform.common;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.databroker.platform.weather.WeatherForecast;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs against the test profile, which sets {@code databroker.query-timeout=30s}.
 */
@Tag("integration")
@QuarkusTest
class QueryTimeoutTest {

    @Inject
    QueryTimeout queryTimeout;

    @Inject
    UnitOfWork unitOfWork;

    @Test
    @DisplayName("configured timeout should be accepted by Hibernate and the query should still run")
    void apply_shouldSetTimeoutHint_whenConfigured() {
        long count = unitOfWork.read(em -> {
            CriteriaBuilder cb = em.getCriteriaBuilder();
            CriteriaQuery<Long> query = cb.createQuery(Long.class);
            query.select(cb.count(query.from(WeatherForecast.class)));

            TypedQuery<Long> typedQuery = em.createQuery(query);

            assertThatCode(() -> queryTimeout.apply(typedQuery)).doesNotThrowAnyException();
            return typedQuery.getSingleResult();
        });

        assertThat(count).isPositive();
    }
}
