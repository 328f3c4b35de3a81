package com.jeevanfit.backend.food.model;

import java.util.List;

public record FoodClassification(
        String itemName,
        FoodCategory category,
        double confidence,
        String rationale,
        List<FoodFactor> dominantFactors,
        FsiParameters parameters,
        boolean ambiguous
) {
    public FoodClassification {
        dominantFactors = List.copyOf(dominantFactors);
    }
}
