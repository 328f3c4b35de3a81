package com.jeevanfit.backend.insight.model;

/**
 * 宣告順序 = 同優先度、同信心時的排序順序。
 */
public enum AnalysisSource {
    FOOD,
    WATER,
    SLEEP,
    BODY_TYPE,
    TREND
}
