package com.jeevanfit.backend.sleep.model;

import com.jeevanfit.backend.common.Recommendation;

import java.util.List;

public record SleepAnalysis(
        SleepQuality overallQuality,
        List<SleepCorrelation> correlations,
        List<Recommendation> recommendations,
        String explanation,
        List<SleepDisruptor> disruptors,
        double confidence
) {
    public SleepAnalysis {
        correlations = List.copyOf(correlations);
        recommendations = List.copyOf(recommendations);
        disruptors = List.copyOf(disruptors);
    }

    public List<SleepCorrelation> negativeCorrelations() {
        return correlations.stream().filter(c -> c.impact() == ImpactType.NEGATIVE).toList();
    }
}
