package com.qa.coverage.cache;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.qa.coverage.engine.AggregateSnapshot;
import com.qa.coverage.engine.Scope;

public class InMemoryTrendCache implements TrendCache {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTrendCache.class);

    private final long bucketMillis;
    private final Map<TrendCacheKey, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();

    public InMemoryTrendCache(long bucketMillis) {
        if (bucketMillis <= 0) {
            throw new IllegalArgumentException("bucketMillis must be positive, got " + bucketMillis);
        }
        this.bucketMillis = bucketMillis;
    }

    @Override
    public TrendCacheKey keyFor(String scopeSignature, int windowDays, Instant now) {
        return new TrendCacheKey(scopeSignature, windowDays, Math.floorDiv(now.toEpochMilli(), bucketMillis));
    }

    @Override
    public Optional<List<AggregateSnapshot>> get(TrendCacheKey key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            logger.debug("Trend cache miss {}", key);
            return Optional.empty();
        }
        logger.debug("Trend cache hit {}", key);
        return Optional.of(entry.trend);
    }

    @Override
    public long generation() {
        return generation.get();
    }

    @Override
    public synchronized void put(TrendCacheKey key, Scope scope, List<AggregateSnapshot> trend, long seenGeneration) {
        if (seenGeneration != generation.get()) {
            logger.debug("Not caching trend {}: invalidated while it was computed", key);
            return;
        }
        // older buckets can never be asked for again
        entries.keySet().removeIf(k -> k.getNowBucket() < key.getNowBucket());
        entries.put(key, new Entry(scope.isUnrestricted(), scope.getTestCaseIds(), trend));
    }

    @Override
    public synchronized void invalidateTestCase(Long testCaseId) {
        generation.incrementAndGet();
        int before = entries.size();
        entries.values().removeIf(e -> e.unrestricted || e.testCaseIds.contains(testCaseId));
        logger.debug("Invalidated {} trend cache entries for test case {}", before - entries.size(), testCaseId);
    }

    @Override
    public synchronized void invalidateAll() {
        generation.incrementAndGet();
        entries.clear();
    }

    @Override
    public int size() {
        return entries.size();
    }

    private static final class Entry {
        private final boolean unrestricted;
        private final Set<Long> testCaseIds;
        private final List<AggregateSnapshot> trend;

        private Entry(boolean unrestricted, Set<Long> testCaseIds, List<AggregateSnapshot> trend) {
            this.unrestricted = unrestricted;
            this.testCaseIds = testCaseIds;
            this.trend = Collections.unmodifiableList(trend);
        }
    }
}
