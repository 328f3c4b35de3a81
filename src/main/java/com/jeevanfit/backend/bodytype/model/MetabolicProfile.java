package com.jeevanfit.backend.bodytype.model;

/**
 * 1..10 的相對傾向分數；MIXED 為三種體質的平均，所以用 double。
 */
public record MetabolicProfile(
        MetabolicRate baseMetabolicRate,
        double carbSensitivity,
        double fatStorageTendency,
        double muscleGainPotential,
        double recoverySpeed
) {}
