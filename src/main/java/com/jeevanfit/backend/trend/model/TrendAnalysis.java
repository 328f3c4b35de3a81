package com.jeevanfit.backend.trend.model;

import com.jeevanfit.backend.common.AnalysisError;

import java.util.List;

/**
 * notice：資料不足等降級情況（PROCESSING），正常時為 null。
 */
public record TrendAnalysis(
        List<Pattern> patterns,
        List<Correlation> correlations,
        List<Change> changes,
        List<ChartData> charts,
        AnalysisError notice,
        double confidence
) {
    public TrendAnalysis {
        patterns = List.copyOf(patterns);
        correlations = List.copyOf(correlations);
        changes = List.copyOf(changes);
        charts = List.copyOf(charts);
    }

    public boolean degraded() {
        return notice != null;
    }
}
