package com.jeevanfit.backend.trend.model;

public enum CausalityLevel {
    LIKELY,
    POSSIBLE,
    UNLIKELY
}
