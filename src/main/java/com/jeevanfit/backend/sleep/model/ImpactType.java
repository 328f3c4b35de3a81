package com.jeevanfit.backend.sleep.model;

public enum ImpactType {
    POSITIVE,
    NEGATIVE,
    NEUTRAL
}
