package com.jeevanfit.backend.trend.model;

public record Pattern(
        LifestyleMetric metric,
        TrendType trend,
        double confidence,
        double slope,
        String description,
        TimeRange timeRange
) {}
