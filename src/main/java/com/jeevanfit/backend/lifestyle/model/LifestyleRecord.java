package com.jeevanfit.backend.lifestyle.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.ToDoubleFunction;

/**
 * 單一使用者「一天」的生活紀錄（已由上游驗證過）。
 * pipeline 只讀不寫；list 在建構時就複製成不可變。
 */
public record LifestyleRecord(
        LocalDateTime timestamp,
        String userId,
        List<FoodItem> foods,
        double waterMl,
        SleepData sleep,
        List<Habit> habits
) {
    public LifestyleRecord {
        foods = (foods == null) ? List.of() : List.copyOf(foods);
        habits = (habits == null) ? List.of() : List.copyOf(habits);
    }

    public double totalSodiumMg() { return sum(NutritionalInfo::sodium); }
    public double totalCalories() { return sum(NutritionalInfo::calories); }
    public double totalProtein() { return sum(NutritionalInfo::protein); }
    public double totalCarbs() { return sum(NutritionalInfo::carbs); }
    public double totalSugar() { return sum(NutritionalInfo::sugar); }

    public List<Habit> habitsOf(HabitType type) {
        return habits.stream().filter(h -> h.type() == type).toList();
    }

    public OptionalInt maxIntensity(HabitType type) {
        return habits.stream()
                .filter(h -> h.type() == type)
                .mapToInt(Habit::intensity)
                .max();
    }

    public boolean hasHabit(HabitType type) {
        return habits.stream().anyMatch(h -> h.type() == type);
    }

    private double sum(ToDoubleFunction<NutritionalInfo> f) {
        double total = 0.0;
        for (FoodItem item : foods) {
            if (item == null || item.nutrition() == null) continue;
            total += f.applyAsDouble(item.nutrition());
        }
        return total;
    }
}
