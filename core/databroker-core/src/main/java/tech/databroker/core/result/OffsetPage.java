package tech.databroker.core.result;

import tech.databroker.core.request.ListQueryRequest;

import java.util.List;

/**
 * Offset-based page view over a {@link ListQueryResult}.
 *
 * <p>Useful to UI list components that need the total to size a pager or a virtualized
 * scroll area. The total is capped at {@link Integer#MAX_VALUE}.
 *
 * @param <T> The type of items in the page
 * @param items The items on this page
 * @param total Total number of items matching the filter (all pages)
 * @param offset The offset used for this page
 * @param limit The page size limit, 0 when the query was not paged
 */
public record OffsetPage<T>(
    List<T> items,
    int total,
    int offset,
    int limit
) {
    /**
     * Create an empty page with no results.
     */
    public static <T> OffsetPage<T> empty() {
        return new OffsetPage<>(List.of(), 0, 0, 0);
    }

    /**
     * Build the page for a request and its result. A failed result gives an empty page.
     */
    public static <T> OffsetPage<T> of(ListQueryRequest request, ListQueryResult<T> result) {
        if (!result.successful()) {
            return empty();
        }
        int total = result.totalCount() > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) result.totalCount();
        return new OffsetPage<>(result.items(), total, request.startIndex(), request.pageSize());
    }

    /**
     * Calculate current page number (0-based).
     */
    public int pageNumber() {
        return limit > 0 ? offset / limit : 0;
    }

    /**
     * Calculate total number of pages.
     */
    public int totalPages() {
        if (limit == 0) {
            return total > 0 ? 1 : 0;
        }
        return (int) Math.ceil((double) total / limit);
    }

    /**
     * Check if there are more pages after this one.
     */
    public boolean hasMore() {
        return offset + items.size() < total;
    }
}
