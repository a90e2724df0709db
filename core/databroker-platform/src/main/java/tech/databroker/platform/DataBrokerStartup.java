package tech.databroker.platform;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.databroker.platform.config.DataBrokerConfig;
import tech.databroker.platform.weather.testdata.WeatherTestDataProvider;

/**
 * Data broker startup handler.
 *
 * <p>Seeds the sample weather forecasts when {@code databroker.test-data.enabled} is set.
 */
@ApplicationScoped
public class DataBrokerStartup {

    private static final Logger LOG = Logger.getLogger(DataBrokerStartup.class);

    @Inject
    DataBrokerConfig config;

    @Inject
    WeatherTestDataProvider testDataProvider;

    void onStart(@Observes StartupEvent event) {
        if (config.testData().enabled()) {
            testDataProvider.loadDatabase();
        }
        LOG.infof("Data broker started (slow operation threshold %dms)",
            config.slowOperationThreshold().toMillis());
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.info("Data broker shutdown");
    }
}
