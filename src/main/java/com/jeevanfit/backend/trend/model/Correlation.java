package com.jeevanfit.backend.trend.model;

/**
 * strength：Pearson r ∈ [-1, 1]；lagDays：metricB 比 metricA 晚幾天。
 */
public record Correlation(
        LifestyleMetric metricA,
        LifestyleMetric metricB,
        double strength,
        int lagDays,
        int sampleSize,
        CausalityLevel causality,
        String description
) {}
