package tech.databroker.platform.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the data broker.
 */
@ConfigMapping(prefix = "databroker")
public interface DataBrokerConfig {

    /**
     * Handler calls taking longer than this are logged as slow.
     * Uses Quarkus duration format (e.g., "100ms", "2s").
     */
    @WithDefault("100ms")
    Duration slowOperationThreshold();

    /**
     * Timeout applied to list, count and report queries. No timeout when unset.
     */
    Optional<Duration> queryTimeout();

    /**
     * Sample data seeding.
     */
    TestData testData();

    interface TestData {

        /**
         * Whether to load the sample weather forecasts at start-up.
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * Number of sample weather forecasts to generate.
         */
        @WithDefault("100")
        int recordCount();
    }
}
