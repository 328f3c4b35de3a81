package com.jeevanfit.backend.lifestyle.model;

import java.time.LocalTime;

/**
 * intensity：1..10；duration：小時（可為 null）；timing：發生時間（可為 null）
 */
public record Habit(
        HabitType type,
        int intensity,
        Double duration,
        LocalTime timing
) {
    public static Habit of(HabitType type, int intensity, LocalTime timing) {
        return new Habit(type, intensity, null, timing);
    }
}
