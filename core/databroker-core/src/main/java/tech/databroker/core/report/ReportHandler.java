package tech.databroker.core.report;

import tech.databroker.core.result.ListQueryResult;

/**
 * Produces one report.
 *
 * @param <R> the report request type
 * @param <T> the record type the report returns
 */
public interface ReportHandler<R extends ReportRequest, T> {

    Class<R> requestType();

    Class<T> recordType();

    ListQueryResult<T> execute(R request);

    /**
     * Name of the report, taken from {@link ReportHandlerName}. Empty if the handler is
     * not annotated. The annotation is inherited, so container proxies of the handler
     * report the same name.
     */
    default String reportName() {
        ReportHandlerName name = getClass().getAnnotation(ReportHandlerName.class);
        return name != null ? name.value() : "";
    }
}
