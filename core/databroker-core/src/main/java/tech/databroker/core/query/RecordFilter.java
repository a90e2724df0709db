package tech.databroker.core.query;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import tech.databroker.core.RecordTyped;
import tech.databroker.core.request.FilterDefinition;

import java.util.Optional;

/**
 * Translates named filters into ORM predicates for one record type.
 *
 * <p>The list pipeline calls the filter once per {@link FilterDefinition} in the request
 * and combines the returned predicates with AND.
 *
 * @param <T> the record type
 */
public interface RecordFilter<T> extends RecordTyped<T> {

    /**
     * Build the predicate for {@code filter}.
     *
     * @return the predicate, or empty if this filter does not know the filter name
     */
    Optional<Predicate> toPredicate(FilterDefinition filter, CriteriaBuilder cb, Root<T> root);
}
