package com.jeevanfit.backend.food.model;

/**
 * 宣告順序 = 平手時的保守優先序（JUNK > PRESERVATIVE_HEAVY > HEALTHY）。
 */
public enum FoodCategory {
    JUNK,
    PRESERVATIVE_HEAVY,
    HEALTHY
}
