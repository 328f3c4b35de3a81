package com.jeevanfit.backend.trend.model;

public enum TrendType {
    INCREASING,
    DECREASING,
    STABLE,
    CYCLICAL
}
