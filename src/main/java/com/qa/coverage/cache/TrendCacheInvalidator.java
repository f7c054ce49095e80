package com.qa.coverage.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.stereotype.Component;

import com.qa.coverage.events.ExecutionRecordedEvent;

@Component
public class TrendCacheInvalidator {

    private static final Logger logger = LoggerFactory.getLogger(TrendCacheInvalidator.class);

    private final TrendCache trendCache;

    public TrendCacheInvalidator(TrendCache trendCache) {
        this.trendCache = trendCache;
    }

    // after commit, so a trend computed right after invalidation already sees the new record
    @TransactionalEventListener(fallbackExecution = true)
    public void onExecutionRecorded(ExecutionRecordedEvent event) {
        if (event.getTestCaseId() == null) {
            logger.info("{} event without test case -> dropping every cached trend", event.getEventSource());
            trendCache.invalidateAll();
            return;
        }
        logger.debug("{} event for test case {} -> invalidating cached trends", event.getEventSource(),
                event.getTestCaseId());
        trendCache.invalidateTestCase(event.getTestCaseId());
    }
}
