package com.qa.coverage.cache;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.qa.coverage.engine.AggregateSnapshot;
import com.qa.coverage.engine.Scope;

/**
 * Cache for computed trends, keyed by (scope signature, window, bucket of "now").
 *
 * <p>Contract: a new execution or automation run for a test case invalidates every entry whose scope
 * contains that test case. Entries never outlive their now-bucket.
 */
public interface TrendCache {

    TrendCacheKey keyFor(String scopeSignature, int windowDays, Instant now);

    Optional<List<AggregateSnapshot>> get(TrendCacheKey key);

    /** Bumped by every invalidation; read it before loading data for a put. */
    long generation();

    /** Stores the trend unless an invalidation happened since {@code generation} was read. */
    void put(TrendCacheKey key, Scope scope, List<AggregateSnapshot> trend, long generation);

    void invalidateTestCase(Long testCaseId);

    void invalidateAll();

    int size();
}
