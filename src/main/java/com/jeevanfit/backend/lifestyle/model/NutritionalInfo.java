package com.jeevanfit.backend.lifestyle.model;

import java.util.List;

/**
 * 單份營養資訊（per serving）。
 * - sodium：mg
 * - protein / carbs / fat / sugar / fiber：g
 * - processingLevel：1（幾乎未加工）..5（高度加工）
 */
public record NutritionalInfo(
        double calories,
        double protein,
        double carbs,
        double fat,
        double sodium,
        double sugar,
        double fiber,
        List<String> preservatives,
        int processingLevel
) {
    public NutritionalInfo {
        preservatives = (preservatives == null) ? List.of() : List.copyOf(preservatives);
    }

    public int preservativeCount() {
        return preservatives.size();
    }
}
