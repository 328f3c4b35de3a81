package com.jeevanfit.backend.insight.model;

import java.util.List;

/**
 * concerning：結果本身屬於「需要留意」的類型（JUNK、retention HIGH、POOR sleep、顯著變化…），
 * 教育內容會因此加上建議諮詢專業人士的句子。
 */
public record Insight(
        String title,
        String summary,
        String detail,
        InsightPriority priority,
        InsightCategory category,
        boolean actionable,
        boolean concerning,
        List<String> relatedTitles,
        AnalysisSource source,
        double confidence,
        List<String> rationale
) {
    public Insight {
        relatedTitles = (relatedTitles == null) ? List.of() : List.copyOf(relatedTitles);
        rationale = (rationale == null) ? List.of()
                : rationale.stream().filter(s -> s != null && !s.isBlank()).toList();
        if (rationale.isEmpty()) throw new IllegalArgumentException("RATIONALE_REQUIRED");
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public Insight withRelatedTitles(List<String> titles) {
        return new Insight(title, summary, detail, priority, category, actionable, concerning,
                titles, source, confidence, rationale);
    }
}
