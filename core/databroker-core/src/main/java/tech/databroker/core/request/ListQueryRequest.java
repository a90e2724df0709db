package tech.databroker.core.request;

import java.util.ArrayList;
import java.util.List;

/**
 * Query for a page of records.
 *
 * <p>The list pipeline applies the filters, counts the matching records, applies the
 * sort and finally the paging window. A {@code pageSize} of zero disables paging and
 * returns every matching record.
 *
 * <p>Example usage:
 * <pre>{@code
 * var request = ListQueryRequest.builder()
 *     .sortField("summary")
 *     .filter(new FilterDefinition("BySummary", "Balmy"))
 *     .startIndex(0)
 *     .pageSize(20)
 *     .build();
 * }</pre>
 *
 * @param startIndex     Index of the first record to return
 * @param pageSize       Maximum number of records to return, 0 for all
 * @param sortDescending Whether to sort in descending order
 * @param filters        Filters to apply, in order
 * @param sortField      Name of the field to sort on, empty for unsorted
 */
public record ListQueryRequest(
    int startIndex,
    int pageSize,
    boolean sortDescending,
    List<FilterDefinition> filters,
    String sortField
) {
    public static final int DEFAULT_PAGE_SIZE = 1000;

    public ListQueryRequest {
        if (startIndex < 0) {
            throw new IllegalArgumentException("Start index cannot be negative: " + startIndex);
        }
        if (pageSize < 0) {
            throw new IllegalArgumentException("Page size cannot be negative: " + pageSize);
        }
        filters = filters == null ? List.of() : List.copyOf(filters);
        sortField = sortField == null ? "" : sortField;
    }

    /**
     * A request for the first {@value #DEFAULT_PAGE_SIZE} records, unsorted and unfiltered.
     */
    public static ListQueryRequest defaults() {
        return builder().build();
    }

    public boolean hasSortField() {
        return !sortField.isBlank();
    }

    public boolean isPaged() {
        return pageSize > 0;
    }

    public static ListQueryRequestBuilder builder() {
        return new ListQueryRequestBuilder();
    }

    public static class ListQueryRequestBuilder {
        private int startIndex = 0;
        private int pageSize = DEFAULT_PAGE_SIZE;
        private boolean sortDescending = false;
        private final List<FilterDefinition> filters = new ArrayList<>();
        private String sortField = "";

        public ListQueryRequestBuilder startIndex(int startIndex) {
            this.startIndex = startIndex;
            return this;
        }

        public ListQueryRequestBuilder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public ListQueryRequestBuilder sortDescending(boolean sortDescending) {
            this.sortDescending = sortDescending;
            return this;
        }

        public ListQueryRequestBuilder sortField(String sortField) {
            this.sortField = sortField;
            return this;
        }

        public ListQueryRequestBuilder filter(FilterDefinition filter) {
            this.filters.add(filter);
            return this;
        }

        public ListQueryRequestBuilder filters(List<FilterDefinition> filters) {
            this.filters.clear();
            this.filters.addAll(filters);
            return this;
        }

        public ListQueryRequest build() {
            return new ListQueryRequest(startIndex, pageSize, sortDescending, filters, sortField);
        }
    }
}
