package com.jeevanfit.backend.bodytype.service;

import com.jeevanfit.backend.bodytype.model.MetabolicProfile;
import com.jeevanfit.backend.bodytype.model.MetabolicRate;
import com.jeevanfit.backend.bodytype.model.NutritionalNeeds;
import com.jeevanfit.backend.lifestyle.model.BodyTypeClassification;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 固定體質表（class 載入時建一次，之後唯讀）。
 * MIXED = 三種體質逐欄平均，代謝速率固定 MODERATE。
 */
final class MetabolicProfiles {

    private MetabolicProfiles() {}

    private static final Map<BodyTypeClassification, MetabolicProfile> PROFILES;
    private static final Map<BodyTypeClassification, NutritionalNeeds> NEEDS;

    static {
        MetabolicProfile ecto = new MetabolicProfile(MetabolicRate.FAST, 3, 2, 4, 7);
        MetabolicProfile meso = new MetabolicProfile(MetabolicRate.MODERATE, 5, 5, 8, 8);
        MetabolicProfile endo = new MetabolicProfile(MetabolicRate.SLOW, 8, 8, 6, 5);

        Map<BodyTypeClassification, MetabolicProfile> p = new EnumMap<>(BodyTypeClassification.class);
        p.put(BodyTypeClassification.ECTOMORPH, ecto);
        p.put(BodyTypeClassification.MESOMORPH, meso);
        p.put(BodyTypeClassification.ENDOMORPH, endo);
        p.put(BodyTypeClassification.MIXED, new MetabolicProfile(
                MetabolicRate.MODERATE,
                mean(ecto.carbSensitivity(), meso.carbSensitivity(), endo.carbSensitivity()),
                mean(ecto.fatStorageTendency(), meso.fatStorageTendency(), endo.fatStorageTendency()),
                mean(ecto.muscleGainPotential(), meso.muscleGainPotential(), endo.muscleGainPotential()),
                mean(ecto.recoverySpeed(), meso.recoverySpeed(), endo.recoverySpeed())
        ));
        PROFILES = Collections.unmodifiableMap(p);

        NutritionalNeeds ectoN = new NutritionalNeeds(25.0, 55.0, 20.0,
                "5-6 smaller meals throughout the day",
                "Aim for 2.5-3 liters daily. Higher calorie intake calls for more fluids.");
        NutritionalNeeds mesoN = new NutritionalNeeds(30.0, 40.0, 30.0,
                "3-4 balanced meals with optional snacks",
                "Aim for 2-2.5 liters daily, adjusting for activity level.");
        NutritionalNeeds endoN = new NutritionalNeeds(40.0, 25.0, 35.0,
                "3-4 moderate meals, avoiding late-night eating",
                "Aim for 2-3 liters daily. Good hydration supports metabolism.");

        Map<BodyTypeClassification, NutritionalNeeds> n = new EnumMap<>(BodyTypeClassification.class);
        n.put(BodyTypeClassification.ECTOMORPH, ectoN);
        n.put(BodyTypeClassification.MESOMORPH, mesoN);
        n.put(BodyTypeClassification.ENDOMORPH, endoN);
        n.put(BodyTypeClassification.MIXED, new NutritionalNeeds(
                mean(ectoN.proteinRatio(), mesoN.proteinRatio(), endoN.proteinRatio()),
                mean(ectoN.carbRatio(), mesoN.carbRatio(), endoN.carbRatio()),
                mean(ectoN.fatRatio(), mesoN.fatRatio(), endoN.fatRatio()),
                "4-5 balanced meals per day",
                "Aim for 2-2.5 liters daily, adjusting based on activity."
        ));
        NEEDS = Collections.unmodifiableMap(n);
    }

    static MetabolicProfile profile(BodyTypeClassification bodyType) {
        return PROFILES.get(bodyType);
    }

    static NutritionalNeeds needs(BodyTypeClassification bodyType) {
        return NEEDS.get(bodyType);
    }

    private static double mean(double a, double b, double c) {
        return (a + b + c) / 3.0;
    }
}
