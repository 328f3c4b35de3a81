package com.jeevanfit.backend.insight.model;

public enum InsightPriority {
    HIGH,
    MEDIUM,
    LOW
}
