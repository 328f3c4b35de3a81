package com.jeevanfit.backend.trend.model;

import java.time.LocalDateTime;

/**
 * 含頭含尾。
 */
public record TimeRange(LocalDateTime start, LocalDateTime end) {
    public TimeRange {
        if (start == null || end == null) throw new IllegalArgumentException("TIME_RANGE_BOUNDS_REQUIRED");
        if (end.isBefore(start)) throw new IllegalArgumentException("TIME_RANGE_END_BEFORE_START");
    }

    public static TimeRange lastDays(LocalDateTime end, int days) {
        return new TimeRange(end.minusDays(days), end);
    }

    public boolean contains(LocalDateTime t) {
        return t != null && !t.isBefore(start) && !t.isAfter(end);
    }
}
