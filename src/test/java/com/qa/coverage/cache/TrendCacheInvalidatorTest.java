package com.qa.coverage.cache;

import com.qa.coverage.engine.EventSource;
import com.qa.coverage.events.ExecutionRecordedEvent;
import org.junit.Before;
import org.junit.Test;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class TrendCacheInvalidatorTest {

    private TrendCache trendCache;
    private TrendCacheInvalidator invalidator;

    @Before
    public void setUp() {
        trendCache = mock(TrendCache.class);
        invalidator = new TrendCacheInvalidator(trendCache);
    }

    @Test
    public void recordedExecutionInvalidatesItsTestCase() {
        invalidator.onExecutionRecorded(new ExecutionRecordedEvent(this, 5L, EventSource.MANUAL));

        verify(trendCache).invalidateTestCase(5L);
        verify(trendCache, never()).invalidateAll();
    }

    @Test
    public void eventWithoutTestCaseClearsTheCache() {
        invalidator.onExecutionRecorded(new ExecutionRecordedEvent(this, null, EventSource.AUTOMATED));

        verify(trendCache).invalidateAll();
    }
}
