package com.jeevanfit.backend.sleep.model;

/**
 * 固定分級：1-3 POOR、4-6 FAIR、7-8 GOOD、9-10 EXCELLENT
 */
public enum SleepQuality {
    POOR,
    FAIR,
    GOOD,
    EXCELLENT;

    public static SleepQuality fromRating(int quality) {
        if (quality <= 3) return POOR;
        if (quality <= 6) return FAIR;
        if (quality <= 8) return GOOD;
        return EXCELLENT;
    }
}
