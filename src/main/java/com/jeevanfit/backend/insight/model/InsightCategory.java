package com.jeevanfit.backend.insight.model;

/**
 * healthRelated=true 的類別，教育內容一律附完整免責聲明。
 */
public enum InsightCategory {
    NUTRITION(true),
    HYDRATION(true),
    SLEEP(true),
    METABOLISM(true),
    LIFESTYLE_PATTERNS(false);

    private final boolean healthRelated;

    InsightCategory(boolean healthRelated) {
        this.healthRelated = healthRelated;
    }

    public boolean healthRelated() {
        return healthRelated;
    }
}
