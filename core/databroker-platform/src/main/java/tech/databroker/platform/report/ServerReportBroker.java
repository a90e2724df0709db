package tech.databroker.platform.report;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.databroker.core.DataPipelineException;
import tech.databroker.core.report.ReportBroker;
import tech.databroker.core.report.ReportHandler;
import tech.databroker.core.report.ReportRequest;
import tech.databroker.core.result.ListQueryResult;

import java.util.Optional;

/**
 * Finds the {@link ReportHandler} for a request and runs it.
 *
 * <p>A handler is matched by report name first, then by the request type it accepts.
 * Requests nobody handles, or handled for a different record type, produce a failure
 * result.
 */
@ApplicationScoped
public class ServerReportBroker implements ReportBroker {

    private static final Logger LOG = Logger.getLogger(ServerReportBroker.class);

    @Inject
    Instance<ReportHandler<?, ?>> reportHandlers;

    @Override
    @SuppressWarnings("unchecked")
    public <T> ListQueryResult<T> getReport(Class<T> recordType, ReportRequest request) {
        if (request == null) {
            throw new DataPipelineException("No ReportRequest defined in " + getClass().getName());
        }

        Optional<ReportHandler<?, ?>> handler = resolve(request);
        if (handler.isEmpty()
                || !recordType.equals(handler.get().recordType())
                || !handler.get().requestType().isInstance(request)) {
            String message = "A report for " + request.getClass().getName()
                + " is not defined in the services container.";
            LOG.error(message);
            return ListQueryResult.failure(message);
        }

        LOG.debugf("Running report %s with %s", request.reportName(), handler.get().getClass().getName());
        return ((ReportHandler<ReportRequest, T>) handler.get()).execute(request);
    }

    private Optional<ReportHandler<?, ?>> resolve(ReportRequest request) {
        String reportName = request.reportName();
        if (reportName != null && !reportName.isBlank()) {
            for (ReportHandler<?, ?> handler : reportHandlers) {
                if (reportName.equals(handler.reportName())) {
                    return Optional.of(handler);
                }
            }
        }
        for (ReportHandler<?, ?> handler : reportHandlers) {
            if (handler.requestType().equals(request.getClass())) {
                return Optional.of(handler);
            }
        }
        return Optional.empty();
    }
}
