package com.jeevanfit.backend.trend.model;

import com.jeevanfit.backend.lifestyle.model.Habit;
import com.jeevanfit.backend.lifestyle.model.HabitType;
import com.jeevanfit.backend.lifestyle.model.LifestyleRecord;

import java.util.function.Function;

/**
 * 趨勢追蹤的指標；extract 回 null 代表當天沒有這項資料（不是 0）。
 */
public enum LifestyleMetric {
    SODIUM("sodium", r -> r.foods().isEmpty() ? null : r.totalSodiumMg()),
    WATER_INTAKE("water intake", LifestyleRecord::waterMl),
    SLEEP_QUALITY("sleep quality", r -> r.sleep() == null || r.sleep().quality() == null
            ? null : r.sleep().quality().doubleValue()),
    SLEEP_DURATION("sleep duration", r -> r.sleep() == null ? null : r.sleep().duration()),
    CALORIES("calories", r -> r.foods().isEmpty() ? null : r.totalCalories()),
    SUGAR("sugar", r -> r.foods().isEmpty() ? null : r.totalSugar()),
    CAFFEINE("caffeine", r -> (double) r.habitsOf(HabitType.CAFFEINE).stream().mapToInt(Habit::intensity).sum()),
    STRESS("stress", r -> (double) r.maxIntensity(HabitType.STRESS).orElse(0)),
    EXERCISE("exercise", r -> hours(r, HabitType.EXERCISE)),
    SCREEN_TIME("screen time", r -> hours(r, HabitType.SCREEN_TIME));

    private final String label;
    private final Function<LifestyleRecord, Double> extractor;

    LifestyleMetric(String label, Function<LifestyleRecord, Double> extractor) {
        this.label = label;
        this.extractor = extractor;
    }

    public String label() {
        return label;
    }

    public Double extract(LifestyleRecord record) {
        return extractor.apply(record);
    }

    private static Double hours(LifestyleRecord r, HabitType type) {
        double total = 0.0;
        for (Habit h : r.habitsOf(type)) {
            if (h.duration() != null) total += h.duration();
        }
        return total;
    }
}
