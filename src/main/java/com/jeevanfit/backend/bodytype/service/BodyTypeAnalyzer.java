package com.jeevanfit.backend.bodytype.service;

import com.jeevanfit.backend.bodytype.model.BodyTypeInsight;
import com.jeevanfit.backend.bodytype.model.MetabolicProfile;
import com.jeevanfit.backend.bodytype.model.NutritionalNeeds;
import com.jeevanfit.backend.common.AnalysisValidationException;
import com.jeevanfit.backend.common.Recommendation;
import com.jeevanfit.backend.common.RecommendationPriority;
import com.jeevanfit.backend.lifestyle.model.BodyTypeClassification;
import com.jeevanfit.backend.lifestyle.model.LifestyleRecord;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 體質個人化：固定體質表 + 當天紀錄的幾個觀察點（熱量、蛋白質、碳水、糖、水）。
 * bodyType 為 null 時視為 MIXED。
 */
@Service
public class BodyTypeAnalyzer {

    static final double ECTO_MIN_CALORIES = 2000.0;
    static final double MESO_MIN_PROTEIN_G = 60.0;
    static final double MESO_TARGET_PROTEIN_G = 80.0;
    static final double ENDO_HIGH_CARBS_G = 200.0;
    static final double ENDO_HIGH_SUGAR_G = 50.0;
    static final double ENDO_SUGAR_LIMIT_G = 40.0;
    static final double ECTO_WATER_TARGET_ML = 2500.0;
    static final double GENERAL_WATER_TARGET_ML = 2000.0;

    public MetabolicProfile getMetabolicProfile(BodyTypeClassification bodyType) {
        return MetabolicProfiles.profile(orMixed(bodyType));
    }

    public BodyTypeInsight analyze(BodyTypeClassification bodyType, LifestyleRecord record) {
        if (record == null) {
            throw new AnalysisValidationException("record", "Provide today's lifestyle record.");
        }
        BodyTypeClassification bt = orMixed(bodyType);
        MetabolicProfile profile = MetabolicProfiles.profile(bt);
        NutritionalNeeds needs = MetabolicProfiles.needs(bt);

        return new BodyTypeInsight(
                bt,
                profile,
                metabolicResponse(bt, record),
                fatStoragePattern(bt),
                energyUtilization(bt, record),
                needs,
                recommendations(bt, record),
                observations(record),
                bt == BodyTypeClassification.MIXED ? 0.60 : 0.80
        );
    }

    private String metabolicResponse(BodyTypeClassification bt, LifestyleRecord record) {
        switch (bt) {
            case ECTOMORPH: {
                String s = "Your fast metabolism burns through calories quickly, so changes in how much you eat "
                        + "show up rapidly and steady, generous meals help you maintain weight.";
                if (record.totalCalories() < ECTO_MIN_CALORIES) {
                    s += " Today's intake (" + whole(record.totalCalories()) + " kcal) may be on the low side "
                            + "for your metabolic rate; more frequent meals or larger portions could help.";
                }
                return s;
            }
            case MESOMORPH: {
                String s = "Your moderate metabolism processes energy in a balanced way and responds well to "
                        + "changes in nutrition, supporting both weight management and muscle development.";
                if (!record.foods().isEmpty() && record.totalProtein() < MESO_MIN_PROTEIN_G) {
                    s += " A little more protein could make better use of your natural muscle-building potential.";
                }
                return s;
            }
            case ENDOMORPH: {
                String s = "Your slower metabolism conserves energy efficiently, so portion size and food "
                        + "quality matter more because extra calories are stored more readily.";
                if (record.totalCarbs() > ENDO_HIGH_CARBS_G) {
                    s += " Today's carbohydrate intake (" + whole(record.totalCarbs()) + " g) is relatively high; "
                            + "smaller carb portions built around complex carbohydrates may suit you better.";
                }
                return s;
            }
            default:
                return "Your mixed body type shares traits of several types. Your metabolism responds moderately "
                        + "to changes in diet, so finding the macronutrient balance that suits you is the main lever.";
        }
    }

    private String fatStoragePattern(BodyTypeClassification bt) {
        switch (bt) {
            case ECTOMORPH:
                return "Your body has a low tendency to store fat. Even with higher intake, little is stored, "
                        + "which gives dietary flexibility but makes building energy reserves harder.";
            case MESOMORPH:
                return "Your body stores fat in a balanced way, usually spread evenly, and you can gain or lose "
                        + "fat fairly easily with dietary adjustments.";
            case ENDOMORPH:
                return "Your body has a higher tendency to store fat, often around the midsection. Nutrient-dense, "
                        + "lower-calorie foods and consistent meal times help keep composition where you want it.";
            default:
                return "Your fat storage shows mixed traits: moderate overall, with distribution that depends on "
                        + "your habits. Notice how your body responds to different foods and adjust.";
        }
    }

    private String energyUtilization(BodyTypeClassification bt, LifestyleRecord record) {
        switch (bt) {
            case ECTOMORPH: {
                String s = "Your body uses energy rapidly, so long gaps between meals can cause dips. "
                        + "Frequent, smaller meals keep energy steady.";
                if (record.foods().size() < 3) {
                    s += " Spreading food across 4-6 smaller meals could keep your energy more consistent.";
                }
                return s;
            }
            case MESOMORPH:
                return "Your body balances immediate energy use and storage well, keeping energy stable with "
                        + "regular meals and a range of macronutrient mixes.";
            case ENDOMORPH: {
                String s = "Your body is good at conserving energy, which can feel sluggish after simple "
                        + "carbohydrates. Complex carbs and protein keep energy steady without extra storage.";
                if (record.totalSugar() > ENDO_HIGH_SUGAR_G) {
                    s += " Today's sugar intake is high and may lead to energy crashes; swapping some sugar "
                            + "for protein can help.";
                }
                return s;
            }
            default:
                return "Your energy use is moderately efficient. Balanced meals that mix protein, carbohydrates "
                        + "and fats keep energy stable through the day.";
        }
    }

    private List<Recommendation> recommendations(BodyTypeClassification bt, LifestyleRecord record) {
        List<Recommendation> out = new ArrayList<>();
        switch (bt) {
            case ECTOMORPH:
                out.add(new Recommendation(RecommendationPriority.HIGH,
                        "Raise calorie intake with nutrient-dense foods",
                        "A fast metabolism needs more energy to keep up with daily demands.",
                        "Steadier energy, less fatigue and easier weight maintenance."));
                out.add(new Recommendation(RecommendationPriority.MEDIUM,
                        "Eat 5-6 smaller meals through the day",
                        "Frequent meals keep blood sugar and energy steady with a rapid metabolism.",
                        "More consistent energy and fewer hunger spikes."));
                if (record.waterMl() < ECTO_WATER_TARGET_ML) {
                    out.add(new Recommendation(RecommendationPriority.MEDIUM,
                            "Increase water intake to 2.5-3 liters daily",
                            "Higher food intake and a fast metabolism both raise fluid needs.",
                            "Better nutrient absorption and metabolic function."));
                }
                break;
            case MESOMORPH:
                out.add(new Recommendation(RecommendationPriority.HIGH,
                        "Keep a balanced macronutrient mix (30% protein, 40% carbs, 30% fat)",
                        "Your body responds well to balanced nutrition for both muscle and energy.",
                        "Steady energy, efficient recovery and stable body composition."));
                if (record.totalProtein() < MESO_TARGET_PROTEIN_G) {
                    out.add(new Recommendation(RecommendationPriority.MEDIUM,
                            "Add protein to support muscle maintenance",
                            "Your body type has high muscle-building potential that benefits from enough protein.",
                            "Better muscle tone and recovery."));
                }
                break;
            case ENDOMORPH:
                out.add(new Recommendation(RecommendationPriority.HIGH,
                        "Focus on portion control and moderate carbohydrate intake",
                        "A slower metabolism and higher carb sensitivity mean extra carbohydrates are stored more readily.",
                        "Steadier energy and easier weight management."));
                out.add(new Recommendation(RecommendationPriority.HIGH,
                        "Build meals around protein and healthy fats",
                        "Protein and fats keep you full longer and support metabolism without excess carb storage.",
                        "Less hunger and steadier blood sugar."));
                if (record.totalSugar() > ENDO_SUGAR_LIMIT_G) {
                    out.add(new Recommendation(RecommendationPriority.MEDIUM,
                            "Cut back on sugar and choose complex carbohydrates",
                            "Your body type is more sensitive to simple sugars, which can lead to energy crashes.",
                            "Fewer cravings and more stable energy."));
                }
                break;
            default:
                out.add(new Recommendation(RecommendationPriority.HIGH,
                        "Experiment with macronutrient ratios to find your balance",
                        "Mixed body types often do best with a mix that differs from standard guidance.",
                        "A clearer picture of what gives you steady energy."));
                out.add(new Recommendation(RecommendationPriority.MEDIUM,
                        "Track how different foods affect your energy",
                        "Knowing your own responses makes dietary choices more effective.",
                        "Better self-awareness and more effective choices."));
                break;
        }
        return out;
    }

    private List<String> observations(LifestyleRecord record) {
        List<String> out = new ArrayList<>();
        if (!record.foods().isEmpty()) {
            out.add("Calories today: " + whole(record.totalCalories()) + " kcal across "
                    + record.foods().size() + " item(s).");
            out.add("Protein " + whole(record.totalProtein()) + " g, carbohydrates "
                    + whole(record.totalCarbs()) + " g, sugar " + whole(record.totalSugar()) + " g.");
        }
        if (record.waterMl() < GENERAL_WATER_TARGET_ML) {
            out.add("Water intake (" + whole(record.waterMl()) + " ml) is below the 2000 ml reference.");
        } else {
            out.add("Water intake (" + whole(record.waterMl()) + " ml) meets the 2000 ml reference.");
        }
        return out;
    }

    private static BodyTypeClassification orMixed(BodyTypeClassification bodyType) {
        return bodyType == null ? BodyTypeClassification.MIXED : bodyType;
    }

    private static String whole(double v) {
        return String.format(Locale.ROOT, "%.0f", v);
    }
}
