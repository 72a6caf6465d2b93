package io.github.chirino.speakercache.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.util.List;

/**
 * Micrometer configuration for the speaker cache.
 *
 * <ul>
 *   <li>speaker_cache_store_operation_seconds_* - durable backend call timing
 *   <li>speaker_cache_hits_total / speaker_cache_misses_total - lookup outcomes
 *   <li>speaker_cache_tier_changes_total - demotions and promotions
 * </ul>
 */
@ApplicationScoped
public class MetricsConfig {

    static final String STORE_OPERATION = "speaker.cache.store.operation";

    @Produces
    @Singleton
    public MeterFilter applicationTagFilter() {
        return MeterFilter.commonTags(List.of(Tag.of("application", "speaker-cache")));
    }

    /** Percentile histograms for backend round trips, so timeouts show up in p99. */
    @Produces
    @Singleton
    public MeterFilter storeHistogramFilter() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(
                    Meter.Id id, DistributionStatisticConfig config) {
                if (id.getName().equals(STORE_OPERATION)) {
                    return DistributionStatisticConfig.builder()
                            .percentiles(0.95, 0.99)
                            .percentilesHistogram(true)
                            .build()
                            .merge(config);
                }
                return config;
            }
        };
    }
}
