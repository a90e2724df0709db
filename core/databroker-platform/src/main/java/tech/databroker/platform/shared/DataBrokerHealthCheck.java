package tech.databroker.platform.shared;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;
import tech.databroker.core.query.RecordFilter;
import tech.databroker.core.query.RecordSorter;
import tech.databroker.core.report.ReportHandler;
import tech.databroker.platform.common.UnitOfWork;

import java.util.ArrayList;
import java.util.List;

/**
 * Readiness check for the data broker.
 * Reports DOWN if a read-only unit of work cannot reach the database.
 * Lists the registered report names and the number of record filters and sorters.
 */
@ApplicationScoped
@Readiness
public class DataBrokerHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(DataBrokerHealthCheck.class);

    @Inject
    UnitOfWork unitOfWork;

    @Inject
    Instance<ReportHandler<?, ?>> reportHandlers;

    @Inject
    Instance<RecordFilter<?>> filters;

    @Inject
    Instance<RecordSorter<?>> sorters;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder()
            .name("DataBroker")
            .withData("reports", String.join(",", reportNames()))
            .withData("filters", filters.stream().count())
            .withData("sorters", sorters.stream().count());

        try {
            unitOfWork.read(em -> em.createNativeQuery("select 1").getSingleResult());
            return builder.up().build();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Data broker readiness check failed");
            return builder.down().withData("reason", String.valueOf(e.getMessage())).build();
        }
    }

    private List<String> reportNames() {
        List<String> names = new ArrayList<>();
        for (ReportHandler<?, ?> handler : reportHandlers) {
            names.add(handler.reportName());
        }
        return names;
    }
}
