package com.jeevanfit.backend.sleep.model;

/**
 * habit：具名的習慣（cause）；outcome：具名的睡眠結果（effect）。
 * strength：1..10
 */
public record SleepCorrelation(
        String habit,
        ImpactType impact,
        int strength,
        String outcome,
        String description
) {
    /** 「habit is linked to outcome.」一句話的因果配對 */
    public String causeEffectSentence() {
        return habit + " is linked to " + outcome + ".";
    }
}
