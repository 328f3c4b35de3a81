package com.jeevanfit.backend.trend.model;

import java.time.LocalDateTime;
import java.util.List;

public record Change(
        LifestyleMetric metric,
        LocalDateTime changePoint,
        double baseline,
        double latest,
        double magnitude,
        double percentChange,
        String description,
        List<LifestyleMetric> possibleCauses
) {
    public Change {
        possibleCauses = List.copyOf(possibleCauses);
    }
}
