package com.jeevanfit.backend.bodytype.model;

public enum MetabolicRate {
    FAST,
    MODERATE,
    SLOW
}
