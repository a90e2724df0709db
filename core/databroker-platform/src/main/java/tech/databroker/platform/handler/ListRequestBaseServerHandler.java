package tech.databroker.platform.handler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.jboss.logging.Logger;
import tech.databroker.core.DataPipelineException;
import tech.databroker.core.RecordTyped;
import tech.databroker.core.query.RecordFilter;
import tech.databroker.core.query.RecordSortHelper;
import tech.databroker.core.query.RecordSorter;
import tech.databroker.core.request.FilterDefinition;
import tech.databroker.core.request.ListQueryRequest;
import tech.databroker.core.result.ListQueryResult;
import tech.databroker.platform.common.QueryTimeout;
import tech.databroker.platform.common.UnitOfWork;
import tech.databroker.platform.shared.Instrumented;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Generic list query over any mapped entity, built with the JPA Criteria API.
 *
 * <p>The pipeline is: filter, count, sort, page. The total count is taken after the
 * filters and before paging. Filters come from the {@link RecordFilter} registered for
 * the record type; filter names it does not recognise are ignored. The sort comes from
 * the registered {@link RecordSorter}, or is bound to an entity attribute by name when
 * no sorter is registered. An unknown sort field leaves the query unsorted.
 */
@ApplicationScoped
@Instrumented(operation = "list")
public class ListRequestBaseServerHandler {

    private static final Logger LOG = Logger.getLogger(ListRequestBaseServerHandler.class);

    @Inject
    UnitOfWork unitOfWork;

    @Inject
    QueryTimeout queryTimeout;

    @Inject
    Instance<RecordFilter<?>> filters;

    @Inject
    Instance<RecordSorter<?>> sorters;

    @SuppressWarnings("unchecked")
    public <T> ListQueryResult<T> execute(Class<T> recordType, ListQueryRequest request) {
        if (request == null) {
            throw new DataPipelineException("No ListQueryRequest defined in " + getClass().getName());
        }

        Optional<RecordFilter<T>> filter = RecordTyped.select(filters, recordType)
            .map(candidate -> (RecordFilter<T>) candidate);
        Optional<RecordSorter<T>> sorter = RecordTyped.select(sorters, recordType)
            .map(candidate -> (RecordSorter<T>) candidate);

        if (!request.filters().isEmpty() && filter.isEmpty()) {
            LOG.warnf("No RecordFilter registered for %s, %d filter(s) ignored",
                recordType.getSimpleName(), request.filters().size());
        }

        try {
            return unitOfWork.read(em -> {
                long count = count(em, recordType, request, filter);
                List<T> items = fetch(em, recordType, request, filter, sorter);
                LOG.debugf("Listed %d of %d %s records", items.size(), count, recordType.getSimpleName());
                return ListQueryResult.success(items, count);
            });
        } catch (DataPipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            if (e.getCause() instanceof DataPipelineException pipelineException) {
                throw pipelineException;
            }
            LOG.errorf(e, "Error listing %s records", recordType.getSimpleName());
            return ListQueryResult.failure("Error listing records: " + e.getMessage());
        }
    }

    private <T> long count(
            EntityManager em,
            Class<T> recordType,
            ListQueryRequest request,
            Optional<RecordFilter<T>> filter) {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<T> root = query.from(recordType);
        query.select(cb.count(root)).where(predicates(request, filter, cb, root));
        return queryTimeout.apply(em.createQuery(query)).getSingleResult();
    }

    private <T> List<T> fetch(
            EntityManager em,
            Class<T> recordType,
            ListQueryRequest request,
            Optional<RecordFilter<T>> filter,
            Optional<RecordSorter<T>> sorter) {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<T> query = cb.createQuery(recordType);
        Root<T> root = query.from(recordType);
        query.select(root).where(predicates(request, filter, cb, root));

        List<Order> orders = orders(request, sorter, cb, root);
        if (!orders.isEmpty()) {
            query.orderBy(orders);
        }

        TypedQuery<T> typedQuery = queryTimeout.apply(em.createQuery(query));
        if (request.isPaged()) {
            typedQuery.setFirstResult(request.startIndex());
            typedQuery.setMaxResults(request.pageSize());
        }
        return typedQuery.getResultList();
    }

    private <T> Predicate[] predicates(
            ListQueryRequest request,
            Optional<RecordFilter<T>> filter,
            CriteriaBuilder cb,
            Root<T> root) {
        if (filter.isEmpty()) {
            return new Predicate[0];
        }

        List<Predicate> predicates = new ArrayList<>();
        for (FilterDefinition definition : request.filters()) {
            Optional<Predicate> predicate = filter.get().toPredicate(definition, cb, root);
            if (predicate.isPresent()) {
                predicates.add(predicate.get());
            } else {
                LOG.debugf("Ignoring unknown filter %s for %s",
                    definition.filterName(), root.getJavaType().getSimpleName());
            }
        }
        return predicates.toArray(new Predicate[0]);
    }

    private <T> List<Order> orders(
            ListQueryRequest request,
            Optional<RecordSorter<T>> sorter,
            CriteriaBuilder cb,
            Root<T> root) {
        if (!request.hasSortField()) {
            return List.of();
        }

        List<Order> orders = sorter
            .map(s -> s.toOrders(request.sortField(), request.sortDescending(), cb, root))
            .orElseGet(() -> RecordSortHelper
                .buildSortOrder(request.sortField(), request.sortDescending(), cb, root)
                .map(List::of)
                .orElse(List.of()));

        if (orders.isEmpty()) {
            LOG.debugf("Unknown sort field %s for %s, leaving unsorted",
                request.sortField(), root.getJavaType().getSimpleName());
        }
        return orders;
    }
}
