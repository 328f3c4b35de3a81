package com.jeevanfit.backend.lifestyle.model;

import java.time.LocalTime;

/**
 * duration / quality 用包裝型別：上游若漏帶，SleepAnalyzer 要能明確指出缺哪個欄位（不硬猜）。
 */
public record SleepData(
        Double duration,
        Integer quality,
        LocalTime bedtime,
        LocalTime wakeTime,
        int interruptions
) {}
