package com.jeevanfit.backend.water.model;

public record RetentionFactor(
        RetentionFactorType type,
        int points,
        String description,
        String recommendation
) {}
