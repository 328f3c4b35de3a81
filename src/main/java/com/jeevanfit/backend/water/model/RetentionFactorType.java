package com.jeevanfit.backend.water.model;

/**
 * 宣告順序 = primaryFactor 平手時的優先序（SODIUM > SLEEP > HYDRATION > STRESS > HORMONAL）。
 */
public enum RetentionFactorType {
    SODIUM,
    SLEEP,
    HYDRATION,
    STRESS,
    HORMONAL
}
