package tech.databroker.core.result;

import java.util.List;

/**
 * Result of a list query or a report.
 *
 * <p>{@code totalCount} is the number of records matching the filters, independent of
 * the paging window, so callers can size a pager or a virtualized view.
 *
 * @param items      The records in the requested window
 * @param totalCount Number of records matching the filters (all pages)
 * @param successful Whether the query ran
 * @param message    Outcome description, empty if none
 * @param <T>        The record type
 */
public record ListQueryResult<T>(
    List<T> items,
    long totalCount,
    boolean successful,
    String message
) {
    public ListQueryResult {
        items = items == null ? List.of() : List.copyOf(items);
        message = message == null ? "" : message;
    }

    public static <T> ListQueryResult<T> success(List<T> items, long totalCount) {
        return new ListQueryResult<>(items, totalCount, true, "");
    }

    public static <T> ListQueryResult<T> failure(String message) {
        return new ListQueryResult<>(List.of(), 0, false, message);
    }
}
