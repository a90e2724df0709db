package tech.databroker.platform.weather.report;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.jboss.logging.Logger;
import tech.databroker.core.query.RecordSortHelper;
import tech.databroker.core.report.ReportHandler;
import tech.databroker.core.report.ReportHandlerName;
import tech.databroker.core.result.ListQueryResult;
import tech.databroker.platform.common.QueryTimeout;
import tech.databroker.platform.common.UnitOfWork;
import tech.databroker.platform.weather.WeatherForecast;
import tech.databroker.platform.weather.WeatherForecastConstants;

import java.util.List;

@ApplicationScoped
@ReportHandlerName(WeatherForecastConstants.FILTERED_BY_SUMMARY_REPORT)
public class WeatherForecastsFilteredBySummaryHandler
        implements ReportHandler<WeatherForecastsFilteredBySummaryRequest, WeatherForecast> {

    private static final Logger LOG = Logger.getLogger(WeatherForecastsFilteredBySummaryHandler.class);

    @Inject
    UnitOfWork unitOfWork;

    @Inject
    QueryTimeout queryTimeout;

    @Override
    public Class<WeatherForecastsFilteredBySummaryRequest> requestType() {
        return WeatherForecastsFilteredBySummaryRequest.class;
    }

    @Override
    public Class<WeatherForecast> recordType() {
        return WeatherForecast.class;
    }

    @Override
    public ListQueryResult<WeatherForecast> execute(WeatherForecastsFilteredBySummaryRequest request) {
        try {
            return unitOfWork.read(em -> {
                long count = count(em, request);
                List<WeatherForecast> items = fetch(em, request);
                return ListQueryResult.success(items, count);
            });
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error running report %s", request.reportName());
            return ListQueryResult.failure("Error running report " + request.reportName() + ": " + e.getMessage());
        }
    }

    private long count(EntityManager em, WeatherForecastsFilteredBySummaryRequest request) {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<WeatherForecast> root = query.from(WeatherForecast.class);
        query.select(cb.count(root)).where(criteria(request, cb, root));
        return queryTimeout.apply(em.createQuery(query)).getSingleResult();
    }

    private List<WeatherForecast> fetch(EntityManager em, WeatherForecastsFilteredBySummaryRequest request) {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<WeatherForecast> query = cb.createQuery(WeatherForecast.class);
        Root<WeatherForecast> root = query.from(WeatherForecast.class);
        query.select(root).where(criteria(request, cb, root));

        request.sortField()
            .flatMap(field -> RecordSortHelper.buildSortOrder(field, request.sortDescending(), cb, root))
            .ifPresent(order -> query.orderBy(order));

        TypedQuery<WeatherForecast> typedQuery = queryTimeout.apply(em.createQuery(query));
        if (request.pageSize() > 0) {
            typedQuery.setFirstResult(request.startIndex());
            typedQuery.setMaxResults(request.pageSize());
        }
        return typedQuery.getResultList();
    }

    private Predicate[] criteria(WeatherForecastsFilteredBySummaryRequest request, CriteriaBuilder cb, Root<WeatherForecast> root) {
        return request.summary()
            .filter(summary -> !summary.isBlank())
            .map(summary -> new Predicate[] {cb.equal(root.get(WeatherForecastConstants.SUMMARY), summary)})
            .orElseGet(() -> new Predicate[0]);
    }
}
