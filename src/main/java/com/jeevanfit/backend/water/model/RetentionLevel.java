package com.jeevanfit.backend.water.model;

public enum RetentionLevel {
    LOW,
    MODERATE,
    HIGH
}
