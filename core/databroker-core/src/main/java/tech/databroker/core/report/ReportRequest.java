package tech.databroker.core.report;

import java.util.Optional;

/**
 * A request for a named report.
 *
 * <p>Report requests carry the paging and sort fields every report supports. Concrete
 * report requests add their own criteria and are matched to a {@link ReportHandler} by
 * report name or by request type.
 */
public interface ReportRequest {

    int DEFAULT_PAGE_SIZE = 1000;

    String reportName();

    int startIndex();

    int pageSize();

    Optional<String> sortField();

    boolean sortDescending();
}
