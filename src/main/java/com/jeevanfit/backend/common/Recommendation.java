package com.jeevanfit.backend.common;

/**
 * 睡眠與體質分析共用的建議格式。
 */
public record Recommendation(
        RecommendationPriority priority,
        String action,
        String rationale,
        String expectedImpact
) {}
