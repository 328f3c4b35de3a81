package com.jeevanfit.backend.education.service;

import com.jeevanfit.backend.education.model.CauseEffectPair;
import com.jeevanfit.backend.education.model.EducationalContent;
import com.jeevanfit.backend.education.model.EvidenceLevel;
import com.jeevanfit.backend.insight.model.Insight;
import com.jeevanfit.backend.insight.model.InsightCategory;
import com.jeevanfit.backend.insight.model.InsightPriority;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Insight → 給一般使用者看的教育內容。
 * ✅ 所有輸出文字都先過 ensureNonMedical
 * ✅ health-related 類別一律帶完整免責聲明，其餘類別帶簡短說明（不會空白）
 * ✅ 需要留意的 insight 會補一句建議諮詢專業人士
 */
@Service
public class EducationalContentEngine {

    public static final String STANDARD_DISCLAIMER =
            "JeevanFit is an educational tool for habit awareness, not a medical device. "
                    + "This information is for educational purposes only and is not medical advice. "
                    + "If you have health concerns, please consult a healthcare professional.";

    public static final String GENERAL_NOTE =
            "These patterns are shared for habit awareness only and are not medical advice.";

    static final String CONSULTATION_SENTENCE =
            "If these patterns continue, consider talking with a healthcare professional for guidance "
                    + "that fits your situation.";

    // 詞形變化一起列；值不能再含任何禁用詞，ensureNonMedical 才會是 idempotent
    private static final Map<String, String> REPLACEMENTS;
    private static final Pattern FORBIDDEN;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("diagnosis", "observation");
        m.put("diagnoses", "observations");
        m.put("diagnose", "observe");
        m.put("diagnosed", "observed");
        m.put("diagnosing", "observing");
        m.put("treatment", "approach");
        m.put("treatments", "approaches");
        m.put("treat", "address");
        m.put("treats", "addresses");
        m.put("treated", "addressed");
        m.put("treating", "addressing");
        m.put("cure", "improve");
        m.put("cures", "improves");
        m.put("cured", "improved");
        m.put("curing", "improving");
        m.put("disease", "pattern");
        m.put("diseases", "patterns");
        m.put("disorder", "pattern");
        m.put("disorders", "patterns");
        m.put("condition", "pattern");
        m.put("conditions", "patterns");
        m.put("prescribe", "suggest");
        m.put("prescribes", "suggests");
        m.put("prescribed", "suggested");
        m.put("prescribing", "suggesting");
        m.put("prescription", "suggestion");
        m.put("prescriptions", "suggestions");
        m.put("medication", "supplement");
        m.put("medications", "supplements");
        REPLACEMENTS = Collections.unmodifiableMap(m);

        // 長的先比對，避免 "treat" 先吃掉 "treatment"
        List<String> terms = new ArrayList<>(m.keySet());
        terms.sort(Comparator.comparingInt(String::length).reversed());
        FORBIDDEN = Pattern.compile("\\b(" + String.join("|", terms) + ")\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static final Map<InsightCategory, String> CONTEXT;

    static {
        Map<InsightCategory, String> c = new EnumMap<>(InsightCategory.class);
        c.put(InsightCategory.NUTRITION,
                "Knowing how different foods affect your body helps you make informed choices that support your energy.");
        c.put(InsightCategory.HYDRATION,
                "Water balance matters for temperature regulation, nutrient transport and how you feel day to day.");
        c.put(InsightCategory.SLEEP,
                "Sleep supports physical recovery and mental clarity, and your daily habits shape how well you rest.");
        c.put(InsightCategory.METABOLISM,
                "Your metabolic traits influence how you process nutrients, so tailoring habits to them tends to work better.");
        c.put(InsightCategory.LIFESTYLE_PATTERNS,
                "Spotting patterns in your habits makes it easier to change them on purpose.");
        CONTEXT = Collections.unmodifiableMap(c);
    }

    public EducationalContent translate(Insight insight) {
        if (insight == null) throw new IllegalArgumentException("INSIGHT_REQUIRED");

        InsightCategory category = insight.category();
        String categoryName = category.name().replace('_', ' ').toLowerCase(Locale.ROOT);

        String mainMessage = insight.actionable()
                ? "Your " + categoryName + " habits show room for improvement. " + insight.summary()
                : "Understanding your " + categoryName + ": " + insight.summary();

        StringBuilder explanation = new StringBuilder();
        if (insight.detail() != null && !insight.detail().isBlank()) {
            explanation.append(insight.detail()).append(' ');
        }
        explanation.append(CONTEXT.get(category));
        if (concerning(insight)) {
            explanation.append(' ').append(CONSULTATION_SENTENCE);
        }

        List<CauseEffectPair> pairs = new ArrayList<>();
        for (CauseEffectPair p : causeEffect(insight)) {
            pairs.add(new CauseEffectPair(
                    ensureNonMedical(p.cause()),
                    ensureNonMedical(p.effect()),
                    ensureNonMedical(p.mechanism()),
                    p.evidence()
            ));
        }

        String disclaimer = category.healthRelated() ? STANDARD_DISCLAIMER : GENERAL_NOTE;

        return new EducationalContent(
                ensureNonMedical(insight.title()),
                category,
                ensureNonMedical(mainMessage),
                ensureNonMedical(explanation.toString()),
                pairs,
                disclaimer
        );
    }

    /**
     * 禁用詞（含詞形變化）以字邊界、不分大小寫比對並替換；替換字首大小寫跟隨原字。
     */
    public String ensureNonMedical(String text) {
        if (text == null || text.isEmpty()) return text;
        Matcher m = FORBIDDEN.matcher(text);
        return m.replaceAll(r -> Matcher.quoteReplacement(replacementFor(r.group())));
    }

    static String replacementFor(String term) {
        String replacement = REPLACEMENTS.get(term.toLowerCase(Locale.ROOT));
        if (replacement == null) return term;

        if (term.length() > 1 && term.equals(term.toUpperCase(Locale.ROOT))) {
            return replacement.toUpperCase(Locale.ROOT);
        }
        if (Character.isUpperCase(term.charAt(0))) {
            return Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1);
        }
        return replacement;
    }

    private static boolean concerning(Insight insight) {
        if (insight.concerning()) return true;
        return insight.priority() == InsightPriority.HIGH && insight.category().healthRelated();
    }

    private List<CauseEffectPair> causeEffect(Insight insight) {
        String text = (String.join(" ", insight.rationale()) + " " + insight.detail()).toLowerCase(Locale.ROOT);
        List<CauseEffectPair> out = new ArrayList<>();

        switch (insight.category()) {
            case NUTRITION:
                if (text.contains("sodium") || text.contains("salt")) {
                    out.add(new CauseEffectPair(
                            "High sodium intake from processed foods",
                            "More water retention and bloating",
                            "Sodium makes the body hold on to extra water to keep its fluid balance.",
                            EvidenceLevel.WELL_ESTABLISHED));
                }
                if (text.contains("sugar")) {
                    out.add(new CauseEffectPair(
                            "Foods high in added sugar",
                            "Energy spikes followed by dips",
                            "Simple sugars are absorbed quickly, raising blood sugar fast and letting it fall soon after.",
                            EvidenceLevel.SUPPORTED));
                }
                if (text.contains("preservative")) {
                    out.add(new CauseEffectPair(
                            "A diet heavy in preserved, packaged foods",
                            "Fewer fresh nutrients on your plate",
                            "Heavily preserved foods often replace fresh ones that carry more fiber and micronutrients.",
                            EvidenceLevel.THEORETICAL));
                }
                if (text.contains("processing")) {
                    out.add(new CauseEffectPair(
                            "Highly processed foods",
                            "Less lasting fullness per calorie",
                            "Processing strips fiber and structure, so the food digests faster.",
                            EvidenceLevel.SUPPORTED));
                }
                break;
            case HYDRATION:
                if (text.contains("sodium")) {
                    out.add(new CauseEffectPair(
                            "High sodium intake",
                            "Extra water held in the body",
                            "The body retains water to dilute extra sodium and keep its salt balance.",
                            EvidenceLevel.WELL_ESTABLISHED));
                }
                if (text.contains("stress") || text.contains("cortisol")) {
                    out.add(new CauseEffectPair(
                            "Ongoing stress",
                            "A tendency towards bloating",
                            "Stress raises cortisol, which influences how the body manages fluid and salt.",
                            EvidenceLevel.SUPPORTED));
                }
                out.add(new CauseEffectPair(
                        "Daily factors that affect fluid balance",
                        "Changes in how much water your body holds",
                        "Your body adjusts water retention based on sodium, hydration and hormonal signals.",
                        EvidenceLevel.SUPPORTED));
                break;
            case SLEEP:
                if (text.contains("caffeine")) {
                    out.add(new CauseEffectPair(
                            "Caffeine in the evening",
                            "Difficulty falling asleep and lighter sleep",
                            "Caffeine blocks adenosine, the signal that builds sleepiness through the day.",
                            EvidenceLevel.WELL_ESTABLISHED));
                }
                if (text.contains("screen")) {
                    out.add(new CauseEffectPair(
                            "Screen use close to bedtime",
                            "Later sleep onset",
                            "Bright light from screens suppresses melatonin, the hormone that signals night.",
                            EvidenceLevel.WELL_ESTABLISHED));
                }
                if (text.contains("alcohol")) {
                    out.add(new CauseEffectPair(
                            "Alcohol before bed",
                            "More waking in the second half of the night",
                            "Alcohol breaks up the deeper stages of sleep as it wears off.",
                            EvidenceLevel.SUPPORTED));
                }
                if (text.contains("eating")) {
                    out.add(new CauseEffectPair(
                            "Eating late in the evening",
                            "Restless, lighter sleep",
                            "Active digestion keeps body temperature and alertness up at bedtime.",
                            EvidenceLevel.SUPPORTED));
                }
                if (text.contains("stress")) {
                    out.add(new CauseEffectPair(
                            "High stress during the day",
                            "Trouble winding down at night",
                            "Stress hormones keep the body alert when it should be preparing for sleep.",
                            EvidenceLevel.SUPPORTED));
                }
                break;
            case METABOLISM:
                out.add(new CauseEffectPair(
                        "Matching your macronutrient balance to your body type",
                        "Steadier energy through the day",
                        "Body types differ in how readily they use or store carbohydrates and fats.",
                        EvidenceLevel.THEORETICAL));
                break;
            case LIFESTYLE_PATTERNS:
                out.add(new CauseEffectPair(
                        "Repeated daily habits",
                        "Trends you can see over a week or more",
                        "Small habits add up, and tracking them reveals which ones move your numbers.",
                        EvidenceLevel.SUPPORTED));
                break;
        }

        if (out.isEmpty()) {
            out.add(new CauseEffectPair(
                    "Your daily lifestyle habits",
                    "Noticeable patterns in how your body responds",
                    "Consistent habits lead to predictable responses that you can learn to recognize and adjust.",
                    EvidenceLevel.SUPPORTED));
        }
        return out;
    }
}
