package com.jeevanfit.backend.common;

public enum RecommendationPriority {
    HIGH,
    MEDIUM,
    LOW
}
