package com.jeevanfit.backend.trend.model;

import java.util.List;

public record ChartData(LifestyleMetric metric, List<MetricPoint> points, String chartType) {
    public ChartData {
        points = List.copyOf(points);
    }
}
