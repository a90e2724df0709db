package tech.databroker.core.report;

import tech.databroker.core.result.ListQueryResult;

/**
 * Dispatches report requests to their {@link ReportHandler}.
 */
public interface ReportBroker {

    /**
     * Run the report for {@code request}.
     *
     * @return the report rows, or a failure result if no handler produces the report
     */
    <T> ListQueryResult<T> getReport(Class<T> recordType, ReportRequest request);
}
