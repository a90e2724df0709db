package tech.databroker.core.query;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Root;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for sorters that special-case some fields and bind the rest by name.
 *
 * @param <T> the record type
 */
public abstract class RecordSorterBase<T> implements RecordSorter<T> {

    /**
     * Order by the given attributes, all in the same direction.
     */
    protected List<Order> sortBy(boolean sortDescending, CriteriaBuilder cb, Root<T> root, String... attributes) {
        List<Order> orders = new ArrayList<>();
        for (String attribute : attributes) {
            orders.add(sortDescending ? cb.desc(root.get(attribute)) : cb.asc(root.get(attribute)));
        }
        return orders;
    }

    /**
     * Fallback used for fields the subclass does not special-case.
     */
    protected List<Order> sortByField(String sortField, boolean sortDescending, CriteriaBuilder cb, Root<T> root) {
        return RecordSortHelper.buildSortOrder(sortField, sortDescending, cb, root)
            .map(List::of)
            .orElse(List.of());
    }
}
