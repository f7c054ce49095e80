package com.qa.coverage.config;

import java.time.Clock;
import java.time.ZoneId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.qa.coverage.cache.InMemoryTrendCache;
import com.qa.coverage.cache.NoOpTrendCache;
import com.qa.coverage.cache.TrendCache;
import com.qa.coverage.engine.Aggregator;
import com.qa.coverage.engine.EventNormalizer;
import com.qa.coverage.engine.ScopeFilter;
import com.qa.coverage.engine.SourceTiePolicy;
import com.qa.coverage.engine.StatusResolver;
import com.qa.coverage.engine.TrendBuilder;

@Configuration
public class CoverageEngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(CoverageEngineConfig.class);

    @Value("${coverage.reference-zone:UTC}")
    private String referenceZone;

    @Value("${coverage.tie-policy:MANUAL_WINS}")
    private SourceTiePolicy tiePolicy;

    @Value("${coverage.trend.cache.enabled:true}")
    private boolean trendCacheEnabled;

    @Value("${coverage.trend.cache.bucket-ms:60000}")
    private long trendCacheBucketMs;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId referenceZone() {
        ZoneId zone = ZoneId.of(referenceZone);
        logger.info("Coverage engine: reference zone={}, tie policy={}", zone, tiePolicy);
        return zone;
    }

    @Bean
    public EventNormalizer eventNormalizer() {
        return new EventNormalizer();
    }

    @Bean
    public StatusResolver statusResolver() {
        return new StatusResolver(tiePolicy);
    }

    @Bean
    public ScopeFilter scopeFilter() {
        return new ScopeFilter();
    }

    @Bean
    public Aggregator aggregator(StatusResolver statusResolver) {
        return new Aggregator(statusResolver);
    }

    @Bean
    public TrendBuilder trendBuilder(Aggregator aggregator, ZoneId referenceZone) {
        return new TrendBuilder(aggregator, referenceZone);
    }

    @Bean
    public TrendCache trendCache() {
        if (!trendCacheEnabled) {
            logger.info("Trend cache disabled");
            return new NoOpTrendCache();
        }
        logger.info("Trend cache enabled, bucket={} ms", trendCacheBucketMs);
        return new InMemoryTrendCache(trendCacheBucketMs);
    }
}
