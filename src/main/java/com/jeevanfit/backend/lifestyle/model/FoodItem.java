package com.jeevanfit.backend.lifestyle.model;

import java.time.LocalTime;

/**
 * consumedAt 可為 null（沒有記錄時間時，睡眠分析改用 record timestamp 的時間）。
 * fruit=true 時糖分視為天然糖，不套用 sugar 門檻。
 */
public record FoodItem(
        String name,
        double servingSize,
        String unit,
        NutritionalInfo nutrition,
        LocalTime consumedAt,
        boolean fruit
) {
    public static FoodItem of(String name, NutritionalInfo nutrition) {
        return new FoodItem(name, 1.0, "serving", nutrition, null, false);
    }

    public FoodItem at(LocalTime time) {
        return new FoodItem(name, servingSize, unit, nutrition, time, fruit);
    }
}
