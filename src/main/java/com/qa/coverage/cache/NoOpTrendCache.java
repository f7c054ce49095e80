package com.qa.coverage.cache;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.qa.coverage.engine.AggregateSnapshot;
import com.qa.coverage.engine.Scope;

public class NoOpTrendCache implements TrendCache {

    @Override
    public TrendCacheKey keyFor(String scopeSignature, int windowDays, Instant now) {
        return new TrendCacheKey(scopeSignature, windowDays, now.toEpochMilli());
    }

    @Override
    public Optional<List<AggregateSnapshot>> get(TrendCacheKey key) {
        return Optional.empty();
    }

    @Override
    public long generation() {
        return 0L;
    }

    @Override
    public void put(TrendCacheKey key, Scope scope, List<AggregateSnapshot> trend, long generation) {
    }

    @Override
    public void invalidateTestCase(Long testCaseId) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public int size() {
        return 0;
    }
}
