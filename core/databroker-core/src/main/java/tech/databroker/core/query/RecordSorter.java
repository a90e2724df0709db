package tech.databroker.core.query;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Root;
import tech.databroker.core.RecordTyped;

import java.util.List;

/**
 * Translates a sort field name into ORM orderings for one record type.
 *
 * <p>Without a registered sorter the list pipeline binds the sort field directly to the
 * entity attribute of the same name (see {@link RecordSortHelper}).
 *
 * @param <T> the record type
 */
public interface RecordSorter<T> extends RecordTyped<T> {

    /**
     * @return the orderings to apply, most significant first; empty leaves the query unsorted
     */
    List<Order> toOrders(String sortField, boolean sortDescending, CriteriaBuilder cb, Root<T> root);
}
