package com.jeevanfit.backend.food.service;

import com.jeevanfit.backend.common.AnalysisValidationException;
import com.jeevanfit.backend.food.model.FoodCategory;
import com.jeevanfit.backend.food.model.FoodClassification;
import com.jeevanfit.backend.food.model.FoodFactor;
import com.jeevanfit.backend.food.model.FsiParameters;
import com.jeevanfit.backend.lifestyle.model.FoodItem;
import com.jeevanfit.backend.lifestyle.model.NutritionalInfo;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 單一食物分類（非醫療建議）。
 * 純函式：同一份 NutritionalInfo 一定得到同一個 category 與逐字相同的 rationale。
 */
@Service
public class FoodClassifier {

    static final double NUTRIENT_DENSITY_HEALTHY_MIN = 0.7;
    static final double NUTRIENT_DENSITY_JUNK_MAX = 0.3;
    static final int PROCESSING_HEALTHY_MAX = 2;
    static final int PROCESSING_JUNK_MIN = 4;
    static final int PRESERVATIVE_COUNT_HEAVY = 3;
    static final double PRESERVATIVE_LOAD_HEAVY = 0.6;
    static final double SUGAR_JUNK_G = 15.0;
    static final double SODIUM_JUNK_MG = 600.0;

    // 沒有任何候選時的保守預設
    private static final double FALLBACK_CONFIDENCE = 0.5;

    private static final double HIGH_SEVERITY_WEIGHT = 1.5;
    private static final Set<String> HIGH_SEVERITY_PRESERVATIVES = Set.of(
            "nitrite", "nitrate", "bha", "bht", "tbhq", "sulfite", "sulphite", "benzoate"
    );

    public FoodClassification classify(FoodItem item) {
        if (item == null || item.nutrition() == null) {
            throw new AnalysisValidationException("nutrition",
                    "Add the nutrition facts for this food item and try again.");
        }
        NutritionalInfo n = item.nutrition();
        FsiParameters fsi = fsiParameters(item);

        Map<FoodCategory, List<Rule>> rules = new EnumMap<>(FoodCategory.class);
        rules.put(FoodCategory.JUNK, junkRules(item, n, fsi));
        rules.put(FoodCategory.PRESERVATIVE_HEAVY, preservativeRules(n, fsi));
        rules.put(FoodCategory.HEALTHY, healthyRules(n, fsi));

        Map<FoodCategory, Double> scores = new EnumMap<>(FoodCategory.class);
        for (Map.Entry<FoodCategory, List<Rule>> e : rules.entrySet()) {
            Double s = candidateScore(e.getKey(), e.getValue());
            if (s != null) scores.put(e.getKey(), s);
        }

        if (scores.isEmpty()) {
            return fallback(item, n, fsi);
        }

        // EnumMap 依宣告順序走訪 → 只在「嚴格大於」時換人，平手自然留在較保守的類別
        FoodCategory winner = null;
        double best = -1;
        for (Map.Entry<FoodCategory, Double> e : scores.entrySet()) {
            if (e.getValue() > best) {
                best = e.getValue();
                winner = e.getKey();
            }
        }

        double runnerUp = -1;
        for (Map.Entry<FoodCategory, Double> e : scores.entrySet()) {
            if (e.getKey() != winner) runnerUp = Math.max(runnerUp, e.getValue());
        }

        double confidence = (runnerUp < 0)
                ? 0.6 + 0.35 * best
                : 0.6 + 0.35 * Math.min(1.0, best - runnerUp);
        confidence = clamp(confidence, 0.5, 0.95);

        List<FoodFactor> factors = new ArrayList<>();
        for (Rule r : rules.get(winner)) {
            if (r.crossed()) factors.add(r.factor());
        }

        String rationale = rationale(winner, rules, scores);
        return new FoodClassification(item.name(), winner, confidence, rationale, factors, fsi, false);
    }

    public FsiParameters fsiParameters(FoodItem item) {
        NutritionalInfo n = item.nutrition();

        double nutrients = n.protein() + n.fiber();
        double density;
        if (n.calories() > 1.0) {
            density = Math.min(1.0, nutrients / (n.calories() / 100.0));
        } else {
            density = nutrients > 0 ? 1.0 : 0.0;
        }

        double processing = (clampLevel(n.processingLevel()) - 1) / 4.0;
        double load = Math.min(1.0, preservativeSeverity(n.preservatives()) / 5.0);
        double sugar = Math.min(1.0, n.sugar() / 30.0);
        double sodium = Math.min(1.0, n.sodium() / 1000.0);

        return new FsiParameters(density, processing, load, sugar, sodium);
    }

    // ===== rules =====

    private List<Rule> junkRules(FoodItem item, NutritionalInfo n, FsiParameters fsi) {
        int level = clampLevel(n.processingLevel());
        List<Rule> out = new ArrayList<>(4);

        out.add(new Rule(FoodFactor.HIGH_PROCESSING, level >= PROCESSING_JUNK_MIN,
                excess(level, PROCESSING_JUNK_MIN),
                "processing level " + level + " >= " + PROCESSING_JUNK_MIN));

        // 水果的糖視為天然糖，不算 JUNK 的 sugar 規則
        boolean sugarHigh = !item.fruit() && n.sugar() > SUGAR_JUNK_G;
        out.add(new Rule(FoodFactor.HIGH_SUGAR, sugarHigh,
                excess(n.sugar(), SUGAR_JUNK_G),
                "sugar " + fmt(n.sugar()) + "g > " + fmt(SUGAR_JUNK_G) + "g"));

        out.add(new Rule(FoodFactor.HIGH_SODIUM, n.sodium() > SODIUM_JUNK_MG,
                excess(n.sodium(), SODIUM_JUNK_MG),
                "sodium " + fmt(n.sodium()) + "mg > " + fmt(SODIUM_JUNK_MG) + "mg"));

        out.add(new Rule(FoodFactor.LOW_NUTRIENTS, fsi.nutrientDensity() < NUTRIENT_DENSITY_JUNK_MAX,
                shortfall(fsi.nutrientDensity(), NUTRIENT_DENSITY_JUNK_MAX),
                "nutrient density " + fmt2(fsi.nutrientDensity()) + " < " + fmt2(NUTRIENT_DENSITY_JUNK_MAX)));
        return out;
    }

    private List<Rule> preservativeRules(NutritionalInfo n, FsiParameters fsi) {
        int count = n.preservativeCount();
        List<Rule> out = new ArrayList<>(2);

        out.add(new Rule(FoodFactor.PRESERVATIVE_COUNT, count >= PRESERVATIVE_COUNT_HEAVY,
                excess(count, PRESERVATIVE_COUNT_HEAVY),
                count + " preservatives >= " + PRESERVATIVE_COUNT_HEAVY
                + " (" + preservativeList(n.preservatives()) + ")"));

        out.add(new Rule(FoodFactor.PRESERVATIVE_LOAD, fsi.preservativeLoad() >= PRESERVATIVE_LOAD_HEAVY,
                excess(fsi.preservativeLoad(), PRESERVATIVE_LOAD_HEAVY),
                "preservative load " + fmt2(fsi.preservativeLoad()) + " >= " + fmt2(PRESERVATIVE_LOAD_HEAVY)));
        return out;
    }

    private List<Rule> healthyRules(NutritionalInfo n, FsiParameters fsi) {
        int level = clampLevel(n.processingLevel());
        int count = n.preservativeCount();
        List<Rule> out = new ArrayList<>(3);

        out.add(new Rule(FoodFactor.NUTRIENT_DENSITY, fsi.nutrientDensity() > NUTRIENT_DENSITY_HEALTHY_MIN,
                excess(fsi.nutrientDensity(), NUTRIENT_DENSITY_HEALTHY_MIN),
                "nutrient density " + fmt2(fsi.nutrientDensity()) + " > " + fmt2(NUTRIENT_DENSITY_HEALTHY_MIN)));

        out.add(new Rule(FoodFactor.LOW_PROCESSING, level <= PROCESSING_HEALTHY_MAX,
                shortfall(level, PROCESSING_HEALTHY_MAX),
                "processing level " + level + " <= " + PROCESSING_HEALTHY_MAX));

        out.add(new Rule(FoodFactor.FEW_PRESERVATIVES, count < PRESERVATIVE_COUNT_HEAVY,
                shortfall(count, PRESERVATIVE_COUNT_HEAVY),
                count + " preservatives < " + PRESERVATIVE_COUNT_HEAVY));
        return out;
    }

    /**
     * HEALTHY 是 AND：三條都要過，分數取最弱的那條。
     * 其他兩類是 OR：任一條過就成立，分數取最強的那條。
     * 回 null 代表不是候選。
     */
    private static Double candidateScore(FoodCategory category, List<Rule> rules) {
        if (category == FoodCategory.HEALTHY) {
            double min = Double.MAX_VALUE;
            for (Rule r : rules) {
                if (!r.crossed()) return null;
                min = Math.min(min, r.score());
            }
            return min;
        }
        Double max = null;
        for (Rule r : rules) {
            if (!r.crossed()) continue;
            max = (max == null) ? r.score() : Math.max(max, r.score());
        }
        return max;
    }

    private FoodClassification fallback(FoodItem item, NutritionalInfo n, FsiParameters fsi) {
        int level = clampLevel(n.processingLevel());
        boolean cautious = fsi.nutrientDensity() < 0.5 || level >= 3;
        FoodCategory category = cautious ? FoodCategory.JUNK : FoodCategory.HEALTHY;

        String rationale = "No classification threshold was crossed (nutrient density "
                + fmt2(fsi.nutrientDensity()) + ", processing level " + level
                + ", " + n.preservativeCount() + " preservatives); "
                + (cautious
                ? "defaulted to JUNK because nutrient density < 0.50 or processing level >= 3."
                : "defaulted to HEALTHY because nutrient density >= 0.50 and processing level < 3.");

        return new FoodClassification(item.name(), category, FALLBACK_CONFIDENCE, rationale,
                List.of(FoodFactor.OVERALL_COMPOSITION), fsi, true);
    }

    private static String rationale(FoodCategory winner,
                                    Map<FoodCategory, List<Rule>> rules,
                                    Map<FoodCategory, Double> scores) {
        StringBuilder sb = new StringBuilder("Classified as ").append(winner.name()).append(": ");
        sb.append(crossedText(rules.get(winner))).append('.');

        List<String> also = new ArrayList<>();
        for (FoodCategory c : scores.keySet()) {
            if (c == winner) continue;
            also.add(c.name() + " (" + crossedText(rules.get(c)) + ")");
        }
        if (!also.isEmpty()) {
            sb.append(" Also met: ").append(String.join("; ", also)).append('.');
        }
        return sb.toString();
    }

    private static String crossedText(List<Rule> rules) {
        List<String> parts = new ArrayList<>();
        for (Rule r : rules) {
            if (r.crossed()) parts.add(r.text());
        }
        return String.join(", ", parts);
    }

    // ===== helpers =====

    /** 「高於門檻」規則的超出比例：(value - threshold) / threshold，Rule.score() 再截到 [0,1] */
    private static double excess(double value, double threshold) {
        return (value - threshold) / threshold;
    }

    /** 「低於門檻」規則：(threshold - value) / threshold */
    private static double shortfall(double value, double threshold) {
        return (threshold - value) / threshold;
    }

    private static double preservativeSeverity(List<String> preservatives) {
        double total = 0.0;
        for (String p : preservatives) {
            if (p == null || p.isBlank()) continue;
            total += isHighSeverity(p) ? HIGH_SEVERITY_WEIGHT : 1.0;
        }
        return total;
    }

    private static boolean isHighSeverity(String preservative) {
        String v = preservative.trim().toLowerCase(Locale.ROOT);
        for (String key : HIGH_SEVERITY_PRESERVATIVES) {
            if (v.contains(key)) return true;
        }
        return false;
    }

    private static String preservativeList(List<String> preservatives) {
        if (preservatives.size() <= 3) return String.join(", ", preservatives);
        return String.join(", ", preservatives.subList(0, 3))
               + " and " + (preservatives.size() - 3) + " more";
    }

    private static int clampLevel(int level) {
        return Math.max(1, Math.min(5, level));
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static String fmt(double v) {
        if (v == Math.rint(v)) return String.valueOf((long) v);
        return String.format(Locale.ROOT, "%.1f", v);
    }

    private static String fmt2(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }

    private record Rule(FoodFactor factor, boolean crossed, double rawScore, String text) {
        double score() {
            return clamp(rawScore, 0.0, 1.0);
        }
    }
}
