package com.jeevanfit.backend.education.model;

public record CauseEffectPair(
        String cause,
        String effect,
        String mechanism,
        EvidenceLevel evidence
) {
    public CauseEffectPair {
        if (isBlank(cause) || isBlank(effect) || isBlank(mechanism)) {
            throw new IllegalArgumentException("CAUSE_EFFECT_FIELDS_REQUIRED");
        }
        if (evidence == null) evidence = EvidenceLevel.SUPPORTED;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
