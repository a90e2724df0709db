package tech.databroker.core.query;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.Attribute;

import java.util.Optional;

/**
 * Binds a sort field name to an attribute of the mapped entity.
 *
 * <p>The name is matched against the singular attributes of the entity metamodel,
 * exactly first and then ignoring case, so "Summary" and "summary" both bind to the
 * {@code summary} attribute.
 */
public final class RecordSortHelper {

    private RecordSortHelper() {
    }

    public static Optional<Order> buildSortOrder(
            String sortField,
            boolean sortDescending,
            CriteriaBuilder cb,
            Root<?> root) {
        return resolveAttribute(root, sortField)
            .map(attribute -> sortDescending
                ? cb.desc(root.get(attribute))
                : cb.asc(root.get(attribute)));
    }

    /**
     * Find the attribute a sort field name refers to.
     *
     * @return the attribute name as mapped, or empty if the field is blank or unknown
     */
    public static Optional<String> resolveAttribute(Root<?> root, String sortField) {
        if (sortField == null || sortField.isBlank()) {
            return Optional.empty();
        }

        String fallback = null;
        for (Attribute<?, ?> attribute : root.getModel().getAttributes()) {
            if (attribute.isCollection()) {
                continue;
            }
            if (attribute.getName().equals(sortField)) {
                return Optional.of(attribute.getName());
            }
            if (fallback == null && attribute.getName().equalsIgnoreCase(sortField)) {
                fallback = attribute.getName();
            }
        }
        return Optional.ofNullable(fallback);
    }
}
