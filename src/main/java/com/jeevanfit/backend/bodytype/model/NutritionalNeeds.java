package com.jeevanfit.backend.bodytype.model;

/**
 * 巨量營養素比例（%），三者加總為 100。
 */
public record NutritionalNeeds(
        double proteinRatio,
        double carbRatio,
        double fatRatio,
        String mealFrequency,
        String hydrationGuidance
) {}
