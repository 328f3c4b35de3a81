package com.jeevanfit.backend.testsupport;

import com.jeevanfit.backend.lifestyle.model.FoodItem;
import com.jeevanfit.backend.lifestyle.model.Habit;
import com.jeevanfit.backend.lifestyle.model.LifestyleRecord;
import com.jeevanfit.backend.lifestyle.model.NutritionalInfo;
import com.jeevanfit.backend.lifestyle.model.SleepData;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * 測試用的紀錄工廠；預設日期固定，讓輸出可重現。
 */
public final class Fixtures {

    public static final LocalDateTime DAY = LocalDateTime.of(2024, 3, 1, 12, 0);
    public static final LocalTime BEDTIME = LocalTime.of(23, 0);

    private Fixtures() {}

    public static NutritionalInfo nutrition(double calories, double protein, double fiber,
                                            double sugar, double sodium, int level, String... preservatives) {
        return new NutritionalInfo(calories, protein, 20.0, 10.0, sodium, sugar, fiber, List.of(preservatives), level);
    }

    /** 只關心鈉的餐點（其他欄位固定） */
    public static FoodItem meal(double sodiumMg) {
        return FoodItem.of("meal", nutrition(500, 25, 5, 8, sodiumMg, 2));
    }

    public static SleepData sleep(double hours, int quality) {
        return new SleepData(hours, quality, BEDTIME, LocalTime.of(7, 0), 0);
    }

    public static LifestyleRecord record(List<FoodItem> foods, double waterMl, SleepData sleep, Habit... habits) {
        return new LifestyleRecord(DAY, "u1", foods, waterMl, sleep, List.of(habits));
    }

    /** 趨勢測試用：第 offset 天，一份餐點 + 固定睡眠 */
    public static LifestyleRecord day(int offset, double sodiumMg, double waterMl) {
        return new LifestyleRecord(DAY.plusDays(offset), "u1", List.of(meal(sodiumMg)), waterMl, sleep(7.5, 7), List.of());
    }
}
