package tech.databroker.core.report;

import java.util.Optional;

/**
 * Report request with no report-specific criteria.
 */
public record NamedReportRequest(
    String reportName,
    int startIndex,
    int pageSize,
    Optional<String> sortField,
    boolean sortDescending
) implements ReportRequest {

    public NamedReportRequest {
        if (reportName == null) {
            reportName = "";
        }
        if (startIndex < 0 || pageSize < 0) {
            throw new IllegalArgumentException("Start index and page size cannot be negative");
        }
        sortField = sortField == null ? Optional.empty() : sortField;
    }

    public static NamedReportRequest of(String reportName) {
        return new NamedReportRequest(reportName, 0, DEFAULT_PAGE_SIZE, Optional.empty(), false);
    }
}
