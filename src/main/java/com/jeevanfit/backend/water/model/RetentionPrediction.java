package com.jeevanfit.backend.water.model;

import com.jeevanfit.backend.lifestyle.model.BodyTypeClassification;

import java.util.List;

/**
 * rawScore：各因子加總；adjustedScore：乘上體質敏感度後（用來分級）。
 */
public record RetentionPrediction(
        RetentionLevel level,
        double confidence,
        RetentionFactor primaryFactor,
        List<RetentionFactor> contributingFactors,
        String explanation,
        int rawScore,
        double adjustedScore,
        BodyTypeClassification bodyType
) {
    public RetentionPrediction {
        contributingFactors = List.copyOf(contributingFactors);
    }
}
