package com.jeevanfit.backend.sleep.service;

import com.jeevanfit.backend.common.AnalysisValidationException;
import com.jeevanfit.backend.common.Recommendation;
import com.jeevanfit.backend.common.RecommendationPriority;
import com.jeevanfit.backend.lifestyle.model.FoodItem;
import com.jeevanfit.backend.lifestyle.model.Habit;
import com.jeevanfit.backend.lifestyle.model.HabitType;
import com.jeevanfit.backend.lifestyle.model.LifestyleRecord;
import com.jeevanfit.backend.lifestyle.model.SleepData;
import com.jeevanfit.backend.sleep.model.ImpactType;
import com.jeevanfit.backend.sleep.model.SleepAnalysis;
import com.jeevanfit.backend.sleep.model.SleepCorrelation;
import com.jeevanfit.backend.sleep.model.SleepDisruptor;
import com.jeevanfit.backend.sleep.model.SleepDisruptorType;
import com.jeevanfit.backend.sleep.model.SleepQuality;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 習慣 × 睡眠：每條規則同時產生一個 correlation（cause → effect），
 * 負面的規則再帶一個 disruptor，兩者由同一次掃描得出，不會互相矛盾。
 */
@Service
public class SleepAnalyzer {

    static final double CAFFEINE_WINDOW_H = 6.0;
    static final double LATE_EATING_WINDOW_H = 3.0;
    static final double SCREEN_WINDOW_H = 2.0;
    static final double ALCOHOL_WINDOW_H = 3.0;
    static final double EXERCISE_MIN_GAP_H = 3.0;

    static final double LOW_WATER_ML = 1500.0;
    static final double GOOD_WATER_MIN_ML = 2000.0;
    static final double VERY_HIGH_WATER_ML = 4500.0;

    static final int HIGH_STRESS = 7;
    static final int MODERATE_STRESS = 5;

    private static final Comparator<SleepDisruptor> BY_SEVERITY =
            Comparator.comparingInt(SleepDisruptor::severity).reversed()
                    .thenComparing(SleepDisruptor::type);

    private static final Comparator<SleepCorrelation> BY_STRENGTH =
            Comparator.comparingInt(SleepCorrelation::strength).reversed();

    private record Finding(SleepCorrelation correlation, SleepDisruptor disruptor) {}

    public SleepAnalysis analyze(SleepData sleepData, LifestyleRecord record) {
        if (record == null) {
            throw new AnalysisValidationException("record", "Provide today's lifestyle record.");
        }
        if (sleepData == null) {
            throw new AnalysisValidationException("sleep", "Log last night's sleep to see how your habits affect it.");
        }
        if (sleepData.duration() == null) {
            throw new AnalysisValidationException("sleep.duration", "Add how many hours you slept.");
        }
        if (sleepData.quality() == null) {
            throw new AnalysisValidationException("sleep.quality", "Rate your sleep quality from 1 to 10.");
        }

        SleepQuality overall = SleepQuality.fromRating(sleepData.quality());
        List<Finding> findings = scan(sleepData, record);

        List<SleepCorrelation> correlations = findings.stream()
                .map(Finding::correlation)
                .sorted(BY_STRENGTH)
                .toList();
        List<SleepDisruptor> disruptors = disruptorsOf(findings);
        List<Recommendation> recommendations = recommend(overall, disruptors, correlations);
        String explanation = explain(sleepData, overall, correlations);
        double confidence = confidence(sleepData, correlations);

        return new SleepAnalysis(overall, correlations, recommendations, explanation, disruptors, confidence);
    }

    /**
     * 只看當天紀錄找出負面習慣；沒有睡眠資料時回空 list。
     */
    public List<SleepDisruptor> identifyDisruptors(LifestyleRecord record) {
        if (record == null || record.sleep() == null) return List.of();
        return disruptorsOf(scan(record.sleep(), record));
    }

    private static List<SleepDisruptor> disruptorsOf(List<Finding> findings) {
        return findings.stream()
                .map(Finding::disruptor)
                .filter(d -> d != null)
                .sorted(BY_SEVERITY)
                .toList();
    }

    private List<Finding> scan(SleepData sleep, LifestyleRecord record) {
        List<Finding> out = new ArrayList<>();
        LocalTime bedtime = sleep.bedtime();

        // 需要 bedtime 才能判斷「睡前幾小時」
        if (bedtime != null) {
            caffeine(record, bedtime, out);
            lateEating(record, bedtime, out);
            screenTime(record, bedtime, out);
            alcohol(record, bedtime, out);
            exercise(record, bedtime, out);
        }
        hydration(record, out);
        stress(record, out);
        return out;
    }

    private void caffeine(LifestyleRecord record, LocalTime bedtime, List<Finding> out) {
        Double gap = closestGap(record.habitsOf(HabitType.CAFFEINE), bedtime);
        if (gap == null) return;

        if (gap < CAFFEINE_WINDOW_H) {
            int strength = clampStrength((int) (10 - gap));
            out.add(new Finding(
                    new SleepCorrelation("Caffeine " + hours(gap) + " before bed", ImpactType.NEGATIVE, strength,
                            "delayed sleep onset",
                            "Caffeine blocks adenosine, the signal that builds sleepiness, and can stay active for about six hours."),
                    new SleepDisruptor(SleepDisruptorType.CAFFEINE, strength, hours(gap) + " before bed",
                            "Keep caffeine to before 2 PM, or at least six hours before bedtime.")
            ));
        } else {
            out.add(new Finding(
                    new SleepCorrelation("Caffeine earlier in the day", ImpactType.NEUTRAL, 1,
                            "little effect on sleep onset",
                            "Caffeine taken more than six hours before bed has mostly worn off by bedtime."),
                    null
            ));
        }
    }

    private void lateEating(LifestyleRecord record, LocalTime bedtime, List<Finding> out) {
        if (record.foods().isEmpty()) return;

        Double gap = null;
        for (FoodItem item : record.foods()) {
            if (item == null || item.consumedAt() == null) continue;
            double g = hoursBefore(item.consumedAt(), bedtime);
            if (gap == null || g < gap) gap = g;
        }
        // 沒有任何一餐帶時間 → 不知道什麼時候吃的，不判斷
        if (gap == null || gap >= LATE_EATING_WINDOW_H) return;

        int strength = clampStrength((int) (8 - gap * 2));
        out.add(new Finding(
                new SleepCorrelation("Eating " + hours(gap) + " before bed", ImpactType.NEGATIVE, strength,
                        "lighter, more restless sleep",
                        "Digestion raises body temperature and keeps the body active when it should be winding down."),
                new SleepDisruptor(SleepDisruptorType.LATE_EATING, strength, hours(gap) + " before bed",
                        "Finish your last meal two to three hours before bedtime.")
        ));
    }

    private void hydration(LifestyleRecord record, List<Finding> out) {
        double water = record.waterMl();

        if (water < LOW_WATER_ML) {
            out.add(new Finding(
                    new SleepCorrelation("Low water intake (" + whole(water) + "ml)", ImpactType.NEGATIVE, 6,
                            "more night-time waking",
                            "Mild dehydration can cause discomfort, dry mouth and headaches that interrupt sleep."),
                    new SleepDisruptor(SleepDisruptorType.DEHYDRATION, 6, "throughout the day",
                            "Drink steadily during the day and ease off in the last hour before bed.")
            ));
        } else if (water > VERY_HIGH_WATER_ML) {
            out.add(new Finding(
                    new SleepCorrelation("Very high water intake (" + whole(water) + "ml)", ImpactType.NEGATIVE, 4,
                            "night-time waking to use the bathroom",
                            "Large fluid volumes late in the day fill the bladder during the night."),
                    new SleepDisruptor(SleepDisruptorType.OVERHYDRATION, 4, "throughout the day",
                            "Move most of your drinking to earlier in the day.")
            ));
        } else if (water >= GOOD_WATER_MIN_ML) {
            out.add(new Finding(
                    new SleepCorrelation("Steady hydration (" + whole(water) + "ml)", ImpactType.POSITIVE, 3,
                            "fewer sleep interruptions",
                            "Being well hydrated supports comfortable body temperature regulation overnight."),
                    null
            ));
        }
    }

    private void stress(LifestyleRecord record, List<Finding> out) {
        var max = record.maxIntensity(HabitType.STRESS);
        if (max.isEmpty()) return;

        int level = max.getAsInt();
        int strength;
        if (level >= HIGH_STRESS) {
            strength = 9;
        } else if (level >= MODERATE_STRESS) {
            strength = 6;
        } else {
            return;
        }
        out.add(new Finding(
                new SleepCorrelation("Stress (intensity " + level + "/10)", ImpactType.NEGATIVE, strength,
                        "difficulty falling asleep",
                        "Stress keeps cortisol and alertness high, which works against the body's wind-down."),
                new SleepDisruptor(SleepDisruptorType.STRESS, strength, "during the day",
                        "Try a short relaxation routine such as breathing exercises or light stretching before bed.")
        ));
    }

    private void screenTime(LifestyleRecord record, LocalTime bedtime, List<Finding> out) {
        Double gap = closestGap(record.habitsOf(HabitType.SCREEN_TIME), bedtime);
        if (gap == null || gap >= SCREEN_WINDOW_H) return;

        int strength = clampStrength((int) (7 - gap * 2));
        out.add(new Finding(
                new SleepCorrelation("Screen use " + hours(gap) + " before bed", ImpactType.NEGATIVE, strength,
                        "delayed sleep onset",
                        "Bright screen light suppresses melatonin and keeps the mind engaged."),
                new SleepDisruptor(SleepDisruptorType.SCREEN_TIME, strength, hours(gap) + " before bed",
                        "Put screens away an hour before bed or switch to a night-light setting.")
        ));
    }

    private void alcohol(LifestyleRecord record, LocalTime bedtime, List<Finding> out) {
        Double gap = closestGap(record.habitsOf(HabitType.ALCOHOL), bedtime);
        if (gap == null || gap >= ALCOHOL_WINDOW_H) return;

        int strength = clampStrength((int) (8 - gap * 2));
        out.add(new Finding(
                new SleepCorrelation("Alcohol " + hours(gap) + " before bed", ImpactType.NEGATIVE, strength,
                        "fragmented sleep in the second half of the night",
                        "Alcohol can make you drowsy at first but breaks up deeper sleep stages later on."),
                new SleepDisruptor(SleepDisruptorType.ALCOHOL, strength, hours(gap) + " before bed",
                        "Leave at least three hours between your last drink and bedtime.")
        ));
    }

    private void exercise(LifestyleRecord record, LocalTime bedtime, List<Finding> out) {
        boolean early = false;
        for (Habit h : record.habitsOf(HabitType.EXERCISE)) {
            if (h.timing() == null) continue;
            double endGap = hoursBefore(h.timing(), bedtime) - (h.duration() == null ? 0.0 : h.duration());
            if (endGap >= EXERCISE_MIN_GAP_H) {
                early = true;
                break;
            }
        }
        if (!early) return;

        out.add(new Finding(
                new SleepCorrelation("Exercise earlier in the day", ImpactType.POSITIVE, 4,
                        "deeper, more restorative sleep",
                        "Physical activity builds sleep pressure and helps regulate the body clock."),
                null
        ));
    }

    private List<Recommendation> recommend(SleepQuality overall,
                                           List<SleepDisruptor> disruptors,
                                           List<SleepCorrelation> correlations) {
        List<Recommendation> out = new ArrayList<>();
        Set<SleepDisruptorType> seen = EnumSet.noneOf(SleepDisruptorType.class);

        for (SleepDisruptor d : disruptors) {
            if (!seen.add(d.type())) continue;
            RecommendationPriority p = d.severity() >= 7 ? RecommendationPriority.HIGH
                    : d.severity() >= 4 ? RecommendationPriority.MEDIUM
                    : RecommendationPriority.LOW;
            out.add(new Recommendation(p, d.recommendation(),
                    label(d.type()) + " showed up as a sleep disruptor (severity " + d.severity() + "/10).",
                    "Easier time falling and staying asleep."));
        }

        if (overall == SleepQuality.POOR) {
            out.add(new Recommendation(RecommendationPriority.HIGH,
                    "Keep the same bedtime and wake time every day, weekends included.",
                    "A steady schedule trains the body clock and is one of the simplest ways to lift sleep quality.",
                    "More consistent energy and better-rated sleep within one to two weeks."));
        }

        boolean anyNegative = correlations.stream().anyMatch(c -> c.impact() == ImpactType.NEGATIVE);
        if (anyNegative && out.isEmpty()) {
            out.add(new Recommendation(RecommendationPriority.MEDIUM,
                    "Build a calm 30-minute wind-down routine before bed.",
                    "Some of today's habits were linked to weaker sleep.",
                    "Smoother transition into sleep."));
        }

        out.sort(Comparator.comparing(Recommendation::priority));
        return out;
    }

    private String explain(SleepData sleep, SleepQuality overall, List<SleepCorrelation> correlations) {
        StringBuilder sb = new StringBuilder();
        sb.append("Your sleep was ").append(overall.name().toLowerCase(Locale.ROOT))
                .append(" with ").append(String.format(Locale.ROOT, "%.1f", sleep.duration()))
                .append(" hours of rest and a quality rating of ").append(sleep.quality()).append("/10.");
        if (sleep.interruptions() > 0) {
            sb.append(" You woke up ").append(sleep.interruptions()).append(" time(s) during the night.");
        }

        List<SleepCorrelation> negatives = correlations.stream()
                .filter(c -> c.impact() == ImpactType.NEGATIVE)
                .toList();
        if (!negatives.isEmpty()) {
            SleepCorrelation top = negatives.get(0);
            sb.append(' ').append(top.causeEffectSentence()).append(' ').append(top.description());
            if (negatives.size() > 1) {
                List<String> rest = new ArrayList<>();
                for (int i = 1; i < negatives.size(); i++) rest.add(negatives.get(i).habit().toLowerCase(Locale.ROOT));
                sb.append(" Other habits that may have played a part: ").append(String.join(", ", rest)).append('.');
            }
            return sb.toString();
        }

        sb.append(" No habit stood out as disturbing your sleep.");
        correlations.stream()
                .filter(c -> c.impact() == ImpactType.POSITIVE)
                .findFirst()
                .ifPresentOrElse(
                        c -> sb.append(' ').append(c.causeEffectSentence()),
                        () -> sb.append(" A consistent bedtime routine is linked to steadier sleep quality."));
        return sb.toString();
    }

    private static double confidence(SleepData sleep, List<SleepCorrelation> correlations) {
        double c = 0.70 + 0.05 * Math.min(4, correlations.size());
        if (sleep.bedtime() == null) c -= 0.10;
        return Math.max(0.50, Math.min(0.95, c));
    }

    /** 同類習慣中最接近睡前的一筆；沒有 timing 的不算 */
    private static Double closestGap(List<Habit> habits, LocalTime bedtime) {
        Double best = null;
        for (Habit h : habits) {
            if (h.timing() == null) continue;
            double g = hoursBefore(h.timing(), bedtime);
            if (best == null || g < best) best = g;
        }
        return best;
    }

    /**
     * event 到 bedtime 的小時數；event 晚於 bedtime 視為前一天（跨午夜）。
     */
    static double hoursBefore(LocalTime event, LocalTime bedtime) {
        long minutes = Duration.between(event, bedtime).toMinutes();
        if (minutes < 0) minutes += 24 * 60;
        return minutes / 60.0;
    }

    private static int clampStrength(int v) {
        return Math.max(1, Math.min(10, v));
    }

    private static String label(SleepDisruptorType type) {
        String s = type.name().replace('_', ' ').toLowerCase(Locale.ROOT);
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static String hours(double h) {
        return String.format(Locale.ROOT, "%.1fh", h);
    }

    private static String whole(double v) {
        return String.format(Locale.ROOT, "%.0f", v);
    }
}
