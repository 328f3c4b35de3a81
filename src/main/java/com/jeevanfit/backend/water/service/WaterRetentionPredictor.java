package com.jeevanfit.backend.water.service;

import com.jeevanfit.backend.common.AnalysisValidationException;
import com.jeevanfit.backend.lifestyle.model.BodyTypeClassification;
import com.jeevanfit.backend.lifestyle.model.HabitType;
import com.jeevanfit.backend.lifestyle.model.LifestyleRecord;
import com.jeevanfit.backend.lifestyle.model.SleepData;
import com.jeevanfit.backend.water.model.RetentionFactor;
import com.jeevanfit.backend.water.model.RetentionFactorType;
import com.jeevanfit.backend.water.model.RetentionLevel;
import com.jeevanfit.backend.water.model.RetentionPrediction;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 水腫（water retention）加分模型：
 * - sodium：當日總鈉 > 800mg → +3
 * - hydration：< 1500ml → +2；1500..1999ml → +1；> 4500ml → +1（U 型）
 * - sleep：quality <= 5 → +2；否則 duration < 6h → +1
 * - stress：最高強度 >= 7 → +2；>= 5 → +1
 * 加總後乘上體質敏感度，再分級 LOW / MODERATE / HIGH。
 * 運動資料不是必要輸入。
 */
@Service
public class WaterRetentionPredictor {

    static final double HIGH_SODIUM_MG = 800.0;
    static final double LOW_WATER_ML = 1500.0;
    static final double OPTIMAL_WATER_MIN_ML = 2000.0;
    static final double VERY_HIGH_WATER_ML = 4500.0;
    static final int POOR_SLEEP_QUALITY = 5;
    static final double SHORT_SLEEP_HOURS = 6.0;
    static final int HIGH_STRESS = 7;
    static final int MODERATE_STRESS = 5;

    static final double LOW_MAX = 2.0;
    static final double MODERATE_MAX = 5.0;

    private static final Map<BodyTypeClassification, Double> SENSITIVITY;

    static {
        Map<BodyTypeClassification, Double> m = new EnumMap<>(BodyTypeClassification.class);
        m.put(BodyTypeClassification.ECTOMORPH, 0.8);
        m.put(BodyTypeClassification.MESOMORPH, 1.0);
        m.put(BodyTypeClassification.MIXED, 1.1);
        m.put(BodyTypeClassification.ENDOMORPH, 1.3);
        SENSITIVITY = Collections.unmodifiableMap(m);
    }

    // 分數高者優先；同分依 enum 宣告順序
    private static final Comparator<RetentionFactor> BY_IMPACT =
            Comparator.comparingInt(RetentionFactor::points).reversed()
                    .thenComparing(RetentionFactor::type);

    public RetentionPrediction predict(LifestyleRecord record, BodyTypeClassification bodyType) {
        if (record == null) {
            throw new AnalysisValidationException("record", "Provide today's lifestyle record.");
        }
        BodyTypeClassification bt = (bodyType == null) ? BodyTypeClassification.MIXED : bodyType;

        List<RetentionFactor> factors = analyzeFactors(record);
        int raw = factors.stream().mapToInt(RetentionFactor::points).sum();
        double adjusted = raw * sensitivity(bt);
        RetentionLevel level = band(adjusted);

        RetentionFactor primary = factors.isEmpty() ? balancedFactor() : factors.get(0);
        double confidence = confidence(factors, adjusted);
        String explanation = explain(level, primary, factors, bt);

        return new RetentionPrediction(level, confidence, primary, factors, explanation, raw, adjusted, bt);
    }

    /**
     * 所有有貢獻（points > 0）的因子，依影響力排序。
     */
    public List<RetentionFactor> analyzeFactors(LifestyleRecord record) {
        List<RetentionFactor> out = new ArrayList<>(4);
        sodiumFactor(record).ifPresent(out::add);
        hydrationFactor(record).ifPresent(out::add);
        sleepFactor(record).ifPresent(out::add);
        stressFactor(record).ifPresent(out::add);
        out.sort(BY_IMPACT);
        return out;
    }

    public Optional<RetentionFactor> sodiumFactor(LifestyleRecord record) {
        double sodium = record.totalSodiumMg();
        if (sodium <= HIGH_SODIUM_MG) return Optional.empty();

        return Optional.of(new RetentionFactor(
                RetentionFactorType.SODIUM, 3,
                "High sodium intake (" + whole(sodium) + "mg) leads the body to hold extra water to keep its salt balance.",
                "Choose fresh foods over packaged ones and taste before adding salt."
        ));
    }

    public Optional<RetentionFactor> hydrationFactor(LifestyleRecord record) {
        double water = record.waterMl();

        if (water < LOW_WATER_ML) {
            return Optional.of(new RetentionFactor(
                    RetentionFactorType.HYDRATION, 2,
                    "Low water intake (" + whole(water) + "ml) can make the body conserve the water it has.",
                    "Build up gradually towards 2000-3000ml spread across the day."
            ));
        }
        if (water > VERY_HIGH_WATER_ML) {
            return Optional.of(new RetentionFactor(
                    RetentionFactorType.HYDRATION, 1,
                    "Very high water intake (" + whole(water) + "ml) may add to short-term fluid shifts.",
                    "A range of 2000-3500ml per day suits most adults."
            ));
        }
        if (water < OPTIMAL_WATER_MIN_ML) {
            return Optional.of(new RetentionFactor(
                    RetentionFactorType.HYDRATION, 1,
                    "Water intake (" + whole(water) + "ml) is slightly below the 2000ml reference.",
                    "Add a glass or two to reach about 2000ml per day."
            ));
        }
        return Optional.empty();
    }

    public Optional<RetentionFactor> sleepFactor(LifestyleRecord record) {
        SleepData sleep = record.sleep();
        if (sleep == null) return Optional.empty();

        Integer quality = sleep.quality();
        Double duration = sleep.duration();

        if (quality != null && quality <= POOR_SLEEP_QUALITY) {
            return Optional.of(new RetentionFactor(
                    RetentionFactorType.SLEEP, 2,
                    "Poor sleep quality (" + quality + "/10) can upset the hormones that balance body fluids.",
                    "Keep a steady bedtime routine and a dark, quiet room."
            ));
        }
        if (duration != null && duration < SHORT_SLEEP_HOURS) {
            return Optional.of(new RetentionFactor(
                    RetentionFactorType.SLEEP, 1,
                    String.format(Locale.ROOT, "Short sleep (%.1fh) may affect fluid-regulating hormones.", duration),
                    "Aim for 7-9 hours of sleep per night."
            ));
        }
        return Optional.empty();
    }

    public Optional<RetentionFactor> stressFactor(LifestyleRecord record) {
        OptionalInt max = record.maxIntensity(HabitType.STRESS);
        if (max.isEmpty()) return Optional.empty();

        int stress = max.getAsInt();
        if (stress >= HIGH_STRESS) {
            return Optional.of(new RetentionFactor(
                    RetentionFactorType.STRESS, 2,
                    "High stress (intensity " + stress + "/10) raises cortisol, which is linked to water retention and bloating.",
                    "Try short breathing breaks, a walk, or winding down without screens."
            ));
        }
        if (stress >= MODERATE_STRESS) {
            return Optional.of(new RetentionFactor(
                    RetentionFactorType.STRESS, 1,
                    "Moderate stress (intensity " + stress + "/10) may add slightly to water retention.",
                    "Fit a calming activity such as yoga or a short walk into your day."
            ));
        }
        return Optional.empty();
    }

    public double sensitivity(BodyTypeClassification bodyType) {
        return SENSITIVITY.getOrDefault(bodyType, 1.0);
    }

    static RetentionLevel band(double adjustedScore) {
        if (adjustedScore <= LOW_MAX) return RetentionLevel.LOW;
        if (adjustedScore <= MODERATE_MAX) return RetentionLevel.MODERATE;
        return RetentionLevel.HIGH;
    }

    private static RetentionFactor balancedFactor() {
        return new RetentionFactor(
                RetentionFactorType.HYDRATION, 0,
                "Sodium, hydration, sleep and stress were all within their reference ranges.",
                "Keep up your current habits."
        );
    }

    private static double confidence(List<RetentionFactor> factors, double adjusted) {
        if (factors.isEmpty()) return 0.60;

        double base;
        if (factors.size() == 1) {
            base = 0.85;
        } else {
            int separation = factors.get(0).points() - factors.get(1).points();
            base = 0.70 + 0.10 * separation;
        }
        // 很低或很高的分數，結論比較明確
        if (adjusted <= 1 || adjusted >= 7) base += 0.05;
        return Math.max(0.60, Math.min(0.95, base));
    }

    private String explain(RetentionLevel level,
                           RetentionFactor primary,
                           List<RetentionFactor> factors,
                           BodyTypeClassification bodyType) {
        StringBuilder sb = new StringBuilder();
        sb.append("Your lifestyle factors point to ")
                .append(level.name().toLowerCase(Locale.ROOT))
                .append(" water retention today.");

        if (primary.points() > 0) {
            sb.append(" The main contributor is ")
                    .append(primary.type().name().toLowerCase(Locale.ROOT))
                    .append(": ").append(primary.description());
        } else {
            sb.append(' ').append(primary.description());
        }

        List<String> others = new ArrayList<>();
        for (RetentionFactor f : factors) {
            if (f != primary && f.points() >= 2) others.add(f.type().name().toLowerCase(Locale.ROOT));
        }
        if (!others.isEmpty()) {
            sb.append(" Other notable contributors: ").append(String.join(", ", others)).append('.');
        }

        double s = sensitivity(bodyType);
        String bt = bodyType.name().toLowerCase(Locale.ROOT);
        if (s > 1.0) {
            sb.append(" A ").append(bt).append(" body type tends to be more sensitive to these factors.");
        } else if (s < 1.0) {
            sb.append(" A ").append(bt).append(" body type tends to be less sensitive to these factors.");
        }
        return sb.toString();
    }

    private static String whole(double v) {
        return String.format(Locale.ROOT, "%.0f", v);
    }
}
