package tech.databroker.core.request;

/**
 * A named filter applied to a list query.
 *
 * <p>The record type's {@link tech.databroker.core.query.RecordFilter} decides what the
 * name means and how {@code filterData} is interpreted.
 *
 * @param filterName The filter to apply (e.g. "BySummary")
 * @param filterData The filter argument, as text
 */
public record FilterDefinition(
    String filterName,
    String filterData
) {
    public FilterDefinition {
        if (filterName == null || filterName.isBlank()) {
            throw new IllegalArgumentException("Filter name cannot be null or empty");
        }
        filterData = filterData == null ? "" : filterData;
    }
}
