package com.jeevanfit.backend.education.model;

import com.jeevanfit.backend.insight.model.InsightCategory;

import java.util.List;

public record EducationalContent(
        String title,
        InsightCategory category,
        String mainMessage,
        String explanation,
        List<CauseEffectPair> causeEffect,
        String disclaimer
) {
    public EducationalContent {
        causeEffect = List.copyOf(causeEffect);
    }
}
