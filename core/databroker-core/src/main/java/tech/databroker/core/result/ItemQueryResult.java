package tech.databroker.core.result;

import java.util.Optional;

/**
 * Result of a single record query.
 *
 * @param item       The record, null when the query failed
 * @param successful Whether the record was retrieved
 * @param message    Outcome description, empty if none
 * @param <T>        The record type
 */
public record ItemQueryResult<T>(
    T item,
    boolean successful,
    String message
) {
    public ItemQueryResult {
        message = message == null ? "" : message;
    }

    public static <T> ItemQueryResult<T> success(T item) {
        return new ItemQueryResult<>(item, true, "");
    }

    public static <T> ItemQueryResult<T> failure(String message) {
        return new ItemQueryResult<>(null, false, message);
    }

    public Optional<T> asOptional() {
        return successful ? Optional.ofNullable(item) : Optional.empty();
    }
}
