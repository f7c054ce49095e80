package com.qa.coverage.utils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/** Entity timestamps are LocalDateTime values in UTC. */
public final class UtcTimes {

    private UtcTimes() {
    }

    public static Instant toInstant(LocalDateTime utc) {
        return utc == null ? null : utc.toInstant(ZoneOffset.UTC);
    }

    public static LocalDateTime toLocal(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
