package com.jeevanfit.backend.insight.service;

import com.jeevanfit.backend.bodytype.model.BodyTypeInsight;
import com.jeevanfit.backend.common.Recommendation;
import com.jeevanfit.backend.food.model.FoodCategory;
import com.jeevanfit.backend.food.model.FoodClassification;
import com.jeevanfit.backend.insight.model.AnalysisResult;
import com.jeevanfit.backend.insight.model.AnalysisSource;
import com.jeevanfit.backend.insight.model.Insight;
import com.jeevanfit.backend.insight.model.InsightCategory;
import com.jeevanfit.backend.insight.model.InsightPriority;
import com.jeevanfit.backend.sleep.model.ImpactType;
import com.jeevanfit.backend.sleep.model.SleepAnalysis;
import com.jeevanfit.backend.sleep.model.SleepCorrelation;
import com.jeevanfit.backend.sleep.model.SleepDisruptor;
import com.jeevanfit.backend.sleep.model.SleepQuality;
import com.jeevanfit.backend.trend.model.CausalityLevel;
import com.jeevanfit.backend.trend.model.Change;
import com.jeevanfit.backend.trend.model.Correlation;
import com.jeevanfit.backend.trend.model.Pattern;
import com.jeevanfit.backend.trend.model.TrendAnalysis;
import com.jeevanfit.backend.trend.model.TrendType;
import com.jeevanfit.backend.water.model.RetentionFactor;
import com.jeevanfit.backend.water.model.RetentionLevel;
import com.jeevanfit.backend.water.model.RetentionPrediction;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 分析結果 → Insight：
 * 1) 每個結果依 source 產生一到多個 insight
 * 2) 同類別且 rationale 幾乎相同者去重（留信心較高的）
 * 3) 同類別互相連結 relatedTitles
 * 4) 排序：priority → confidence desc → source 順序
 * 輸入 list 不修改。
 */
@Service
public class InsightGenerator {

    static final double HIGH_CONFIDENCE = 0.75;
    static final double MEDIUM_CONFIDENCE = 0.50;
    static final int STRONG_RETENTION_POINTS = 3;
    static final int MAX_DISRUPTOR_INSIGHTS = 2;
    static final double REPORTED_PATTERN_CONFIDENCE = 0.60;

    static final Comparator<Insight> ORDER =
            Comparator.comparing(Insight::priority)
                    .thenComparing(Comparator.comparingDouble(Insight::confidence).reversed())
                    .thenComparing(Insight::source);

    public List<Insight> generate(List<AnalysisResult> results) {
        if (results == null || results.isEmpty()) return List.of();

        List<Insight> drafts = new ArrayList<>();
        for (AnalysisResult r : results) {
            if (r == null) continue;
            switch (r.source()) {
                case FOOD:
                    drafts.add(food(((AnalysisResult.FoodResult) r).classification()));
                    break;
                case WATER:
                    drafts.add(retention(((AnalysisResult.RetentionResult) r).prediction()));
                    break;
                case SLEEP:
                    drafts.addAll(sleep(((AnalysisResult.SleepResult) r).analysis()));
                    break;
                case BODY_TYPE:
                    drafts.add(bodyType(((AnalysisResult.BodyTypeResult) r).insight()));
                    break;
                case TREND:
                    drafts.addAll(trend(((AnalysisResult.TrendResult) r).analysis()));
                    break;
            }
        }

        return prioritize(linkRelated(dedup(drafts)));
    }

    public List<Insight> prioritize(List<Insight> insights) {
        if (insights == null) return List.of();
        List<Insight> out = new ArrayList<>(insights);
        out.sort(ORDER);
        return List.copyOf(out);
    }

    static InsightPriority priority(double confidence, boolean severe, boolean strongSignal, boolean actionable) {
        if (strongSignal) return InsightPriority.HIGH;
        if (severe && confidence >= HIGH_CONFIDENCE) return InsightPriority.HIGH;
        if (actionable && confidence >= MEDIUM_CONFIDENCE) return InsightPriority.MEDIUM;
        return InsightPriority.LOW;
    }

    // ===== per source =====

    private Insight food(FoodClassification c) {
        boolean concerning = c.category() != FoodCategory.HEALTHY;
        String label = switch (c.category()) {
            case JUNK -> "junk food";
            case PRESERVATIVE_HEAVY -> "preservative-heavy food";
            case HEALTHY -> "healthy choice";
        };

        List<String> rationale = new ArrayList<>();
        rationale.add(c.rationale());
        if (c.ambiguous()) rationale.add("The item sat close to the category boundaries, so this is a best estimate.");

        String summary = concerning
                ? c.itemName() + " was classified as " + label + "."
                : c.itemName() + " is a nutrient-dense, lightly processed choice.";
        String detail = concerning
                ? "Swapping " + c.itemName() + " for a less processed option with more protein or fiber "
                + "would lift the overall quality of your day."
                : "Foods like " + c.itemName() + " give you nutrients without much processing. Keep them in rotation.";

        return new Insight(
                capitalize(c.itemName() + ": " + label),
                summary, detail,
                priority(c.confidence(), concerning, false, concerning),
                InsightCategory.NUTRITION, concerning, concerning,
                List.of(), AnalysisSource.FOOD, c.confidence(), rationale
        );
    }

    private Insight retention(RetentionPrediction p) {
        RetentionFactor primary = p.primaryFactor();
        boolean severe = p.level() == RetentionLevel.HIGH;
        boolean strong = primary != null && primary.points() >= STRONG_RETENTION_POINTS;
        boolean actionable = p.level() != RetentionLevel.LOW;

        List<String> rationale = new ArrayList<>();
        for (RetentionFactor f : p.contributingFactors()) rationale.add(f.description());
        if (rationale.isEmpty() && primary != null) rationale.add(primary.description());
        if (rationale.isEmpty()) rationale.add(p.explanation());

        StringBuilder detail = new StringBuilder(p.explanation());
        for (RetentionFactor f : p.contributingFactors()) {
            detail.append(' ').append(f.recommendation());
        }

        return new Insight(
                "Water retention: " + lower(p.level().name()),
                "Your habits point to " + lower(p.level().name()) + " water retention today"
                        + (primary != null && primary.points() > 0
                        ? ", mainly from " + lower(primary.type().name()) + "." : "."),
                detail.toString(),
                priority(p.confidence(), severe, strong, actionable),
                InsightCategory.HYDRATION, actionable, severe,
                List.of(), AnalysisSource.WATER, p.confidence(), rationale
        );
    }

    private List<Insight> sleep(SleepAnalysis a) {
        List<Insight> out = new ArrayList<>();
        boolean severe = a.overallQuality() == SleepQuality.POOR;
        boolean anyDisruptor = !a.disruptors().isEmpty();
        boolean actionable = !a.recommendations().isEmpty();

        List<String> rationale = new ArrayList<>();
        for (SleepCorrelation c : a.negativeCorrelations()) rationale.add(c.causeEffectSentence());
        if (rationale.isEmpty()) {
            for (SleepCorrelation c : a.correlations()) {
                if (c.impact() == ImpactType.POSITIVE) rationale.add(c.causeEffectSentence());
            }
        }
        if (rationale.isEmpty()) rationale.add(a.explanation());

        StringBuilder detail = new StringBuilder(a.explanation());
        for (Recommendation r : a.recommendations()) detail.append(' ').append(r.action());

        out.add(new Insight(
                "Sleep quality: " + lower(a.overallQuality().name()),
                "Last night's sleep was " + lower(a.overallQuality().name()) + ".",
                detail.toString(),
                priority(a.confidence(), severe, anyDisruptor, actionable),
                InsightCategory.SLEEP, actionable, severe,
                List.of(), AnalysisSource.SLEEP, a.confidence(), rationale
        ));

        int n = Math.min(MAX_DISRUPTOR_INSIGHTS, a.disruptors().size());
        for (int i = 0; i < n; i++) {
            SleepDisruptor d = a.disruptors().get(i);
            String what = lower(d.type().name().replace('_', ' '));
            double confidence = Math.min(0.95, 0.55 + 0.04 * d.severity());
            out.add(new Insight(
                    "Sleep disruptor: " + what,
                    capitalize(what) + " (" + d.timing() + ") may be getting in the way of your sleep.",
                    d.recommendation(),
                    priority(confidence, true, true, true),
                    InsightCategory.SLEEP, true, d.severity() >= 7,
                    List.of(), AnalysisSource.SLEEP, confidence,
                    List.of(capitalize(what) + " scored " + d.severity() + "/10 as a sleep disruptor. " + d.recommendation())
            ));
        }
        return out;
    }

    private Insight bodyType(BodyTypeInsight b) {
        List<String> rationale = new ArrayList<>();
        rationale.add(b.metabolicResponse());
        rationale.addAll(b.observations());

        String macros = String.format(Locale.ROOT, "Suggested balance: %.0f%% protein, %.0f%% carbohydrates, %.0f%% fat; %s.",
                b.nutritionalNeeds().proteinRatio(),
                b.nutritionalNeeds().carbRatio(),
                b.nutritionalNeeds().fatRatio(),
                b.nutritionalNeeds().mealFrequency());

        StringBuilder detail = new StringBuilder(macros);
        detail.append(' ').append(b.energyUtilization());
        for (Recommendation r : b.recommendations()) detail.append(' ').append(r.action()).append('.');

        boolean actionable = !b.recommendations().isEmpty();
        return new Insight(
                "Nutrition for your " + lower(b.bodyType().name()) + " body type",
                b.fatStoragePattern(),
                detail.toString(),
                priority(b.confidence(), false, false, actionable),
                InsightCategory.METABOLISM, actionable, false,
                List.of(), AnalysisSource.BODY_TYPE, b.confidence(), rationale
        );
    }

    private List<Insight> trend(TrendAnalysis t) {
        List<Insight> out = new ArrayList<>();

        for (Change c : t.changes()) {
            double deviation = Math.abs(c.percentChange()) / 100.0;
            double confidence = 0.65 + 0.30 * Math.min(1.0, deviation);
            List<String> rationale = new ArrayList<>();
            rationale.add(c.description());
            if (!c.possibleCauses().isEmpty()) {
                List<String> names = c.possibleCauses().stream().map(m -> m.label()).toList();
                rationale.add("Other metrics that shifted at the same time: " + String.join(", ", names) + ".");
            }
            out.add(new Insight(
                    "Change in " + c.metric().label(),
                    c.description(),
                    "Look back at what was different on the day of the change to see what drove it.",
                    priority(confidence, true, false, true),
                    InsightCategory.LIFESTYLE_PATTERNS, true, true,
                    List.of(), AnalysisSource.TREND, confidence, rationale
            ));
        }

        for (Pattern p : t.patterns()) {
            if (p.trend() == TrendType.STABLE || p.confidence() < REPORTED_PATTERN_CONFIDENCE) continue;
            out.add(new Insight(
                    capitalize(p.metric().label()) + " is " + lower(p.trend().name()),
                    p.description(),
                    "Patterns become clearer the more consistently you log.",
                    priority(p.confidence(), false, false, false),
                    InsightCategory.LIFESTYLE_PATTERNS, false, false,
                    List.of(), AnalysisSource.TREND, p.confidence(), List.of(p.description())
            ));
        }

        for (Correlation c : t.correlations()) {
            if (c.causality() == CausalityLevel.UNLIKELY) continue;
            out.add(new Insight(
                    capitalize(c.metricA().label()) + " and " + c.metricB().label() + " move together",
                    c.description(),
                    "Moving together does not prove one causes the other, but it is worth watching.",
                    priority(Math.abs(c.strength()), false, false, false),
                    InsightCategory.LIFESTYLE_PATTERNS, false, false,
                    List.of(), AnalysisSource.TREND, Math.abs(c.strength()), List.of(c.description())
            ));
        }

        if (out.isEmpty()) {
            if (t.notice() != null) {
                out.add(new Insight(
                        "Trends need more history",
                        "There is not enough history yet to show trends.",
                        t.notice().recoverySuggestion(),
                        InsightPriority.LOW,
                        InsightCategory.LIFESTYLE_PATTERNS, false, false,
                        List.of(), AnalysisSource.TREND, t.confidence(),
                        List.of(t.notice().recoverySuggestion())
                ));
            } else {
                out.add(new Insight(
                        "Your habits are steady",
                        "No notable changes or trends stood out in your recent history.",
                        "Consistent habits make it easier to spot what matters when something does change.",
                        InsightPriority.LOW,
                        InsightCategory.LIFESTYLE_PATTERNS, false, false,
                        List.of(), AnalysisSource.TREND, t.confidence(),
                        List.of("All tracked metrics stayed within 30% of their recent averages.")
                ));
            }
        }
        return out;
    }

    // ===== reduction =====

    static List<Insight> dedup(List<Insight> drafts) {
        List<Insight> kept = new ArrayList<>();
        outer:
        for (Insight candidate : drafts) {
            for (int i = 0; i < kept.size(); i++) {
                Insight k = kept.get(i);
                if (k.category() != candidate.category()) continue;
                if (!RationaleSimilarity.nearIdentical(k.rationale(), candidate.rationale())) continue;
                // 理由一樣但講的是不同東西（兩種不同的零食）→ 兩則都留
                if (!RationaleSimilarity.nearIdentical(k.summary(), candidate.summary())) continue;

                if (candidate.confidence() > k.confidence()) kept.set(i, candidate);
                continue outer;
            }
            kept.add(candidate);
        }
        return kept;
    }

    static List<Insight> linkRelated(List<Insight> insights) {
        List<Insight> out = new ArrayList<>(insights.size());
        for (Insight insight : insights) {
            List<String> related = new ArrayList<>();
            for (Insight other : insights) {
                if (other == insight || other.category() != insight.category()) continue;
                if (!other.title().equals(insight.title()) && !related.contains(other.title())) {
                    related.add(other.title());
                }
            }
            out.add(insight.withRelatedTitles(related));
        }
        return out;
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    private static String capitalize(String s) {
        if (s == null || s.isEmpty()) return s;
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
