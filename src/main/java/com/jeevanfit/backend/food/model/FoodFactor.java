package com.jeevanfit.backend.food.model;

public enum FoodFactor {
    NUTRIENT_DENSITY,
    LOW_PROCESSING,
    FEW_PRESERVATIVES,
    HIGH_PROCESSING,
    HIGH_SUGAR,
    HIGH_SODIUM,
    LOW_NUTRIENTS,
    PRESERVATIVE_COUNT,
    PRESERVATIVE_LOAD,
    OVERALL_COMPOSITION
}
