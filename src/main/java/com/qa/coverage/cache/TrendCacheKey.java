package com.qa.coverage.cache;

import java.util.Objects;

public final class TrendCacheKey {

    private final String scopeSignature;
    private final int windowDays;
    private final long nowBucket;

    public TrendCacheKey(String scopeSignature, int windowDays, long nowBucket) {
        this.scopeSignature = scopeSignature;
        this.windowDays = windowDays;
        this.nowBucket = nowBucket;
    }

    public String getScopeSignature() {
        return scopeSignature;
    }

    public int getWindowDays() {
        return windowDays;
    }

    public long getNowBucket() {
        return nowBucket;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TrendCacheKey)) {
            return false;
        }
        TrendCacheKey that = (TrendCacheKey) o;
        return windowDays == that.windowDays
                && nowBucket == that.nowBucket
                && scopeSignature.equals(that.scopeSignature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scopeSignature, windowDays, nowBucket);
    }

    @Override
    public String toString() {
        return scopeSignature + "|" + windowDays + "d|" + nowBucket;
    }
}
