package com.jeevanfit.backend.trend.service;

import com.jeevanfit.backend.common.AnalysisError;
import com.jeevanfit.backend.lifestyle.model.LifestyleRecord;
import com.jeevanfit.backend.trend.model.CausalityLevel;
import com.jeevanfit.backend.trend.model.Change;
import com.jeevanfit.backend.trend.model.ChartData;
import com.jeevanfit.backend.trend.model.Correlation;
import com.jeevanfit.backend.trend.model.LifestyleMetric;
import com.jeevanfit.backend.trend.model.MetricPoint;
import com.jeevanfit.backend.trend.model.Pattern;
import com.jeevanfit.backend.trend.model.TimeRange;
import com.jeevanfit.backend.trend.model.TrendAnalysis;
import com.jeevanfit.backend.trend.model.TrendType;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 時間序列趨勢：pattern（斜率 + 同號比例 + 自相關）、指標間相關（lag 0..3 天）、
 * 最新一天相對 baseline 的顯著變化。history 只讀。
 */
@Service
public class TrendAnalyzer {

    static final int MIN_PATTERN_POINTS = 7;
    static final int MIN_CORRELATION_POINTS = 3;
    static final int MAX_LAG_DAYS = 3;

    static final double STABLE_RELATIVE_DRIFT = 0.05;
    static final double MONOTONIC_AGREEMENT = 0.70;
    static final double CYCLICAL_AUTOCORRELATION = 0.50;
    static final double WEAK_TREND_DISCOUNT = 0.60;

    static final double LIKELY_R = 0.70;
    static final double POSSIBLE_R = 0.40;
    static final double REPORTED_R = 0.30;

    static final double CHANGE_THRESHOLD = 0.30;

    public TrendAnalysis analyzeTrends(List<LifestyleRecord> history, TimeRange timeRange) {
        List<LifestyleRecord> records = TrendSeries.inRange(history, timeRange);
        Map<LifestyleMetric, List<MetricPoint>> series = TrendSeries.all(records, null);

        List<ChartData> charts = new ArrayList<>();
        for (Map.Entry<LifestyleMetric, List<MetricPoint>> e : series.entrySet()) {
            if (!e.getValue().isEmpty()) charts.add(new ChartData(e.getKey(), e.getValue(), "line"));
        }

        List<Correlation> correlations = new ArrayList<>();
        LifestyleMetric[] metrics = LifestyleMetric.values();
        for (int i = 0; i < metrics.length; i++) {
            for (int j = i + 1; j < metrics.length; j++) {
                Correlation c = correlate(metrics[i], series.get(metrics[i]), metrics[j], series.get(metrics[j]));
                if (Math.abs(c.strength()) >= REPORTED_R) correlations.add(c);
            }
        }
        correlations.sort(Comparator.comparingDouble((Correlation c) -> Math.abs(c.strength())).reversed());

        if (records.size() < MIN_PATTERN_POINTS) {
            AnalysisError notice = AnalysisError.processing(
                    "INSUFFICIENT_HISTORY: " + records.size() + " of " + MIN_PATTERN_POINTS + " days available",
                    "Keep logging daily. Trends appear once you have a week of entries.");
            return new TrendAnalysis(List.of(), correlations, List.of(), charts, notice, 0.30);
        }

        List<Pattern> patterns = new ArrayList<>();
        List<Change> changes = new ArrayList<>();
        for (Map.Entry<LifestyleMetric, List<MetricPoint>> e : series.entrySet()) {
            List<MetricPoint> points = e.getValue();
            if (points.size() < MIN_PATTERN_POINTS) continue;

            patterns.add(detectPattern(e.getKey(), points, timeRange));
            Change change = detectChange(e.getKey(), points, series);
            if (change != null) changes.add(change);
        }

        double confidence = patterns.stream().mapToDouble(Pattern::confidence).average().orElse(0.50);
        return new TrendAnalysis(patterns, correlations, changes, charts, null, TrendStats.clamp01(confidence));
    }

    public Correlation detectCorrelations(List<LifestyleRecord> history,
                                          LifestyleMetric metricA,
                                          LifestyleMetric metricB) {
        return correlate(
                metricA, TrendSeries.points(history, metricA, null),
                metricB, TrendSeries.points(history, metricB, null)
        );
    }

    Pattern detectPattern(LifestyleMetric metric, List<MetricPoint> points, TimeRange timeRange) {
        double[] y = TrendSeries.values(points);
        int n = y.length;
        TimeRange range = (timeRange != null)
                ? timeRange
                : new TimeRange(points.get(0).timestamp(), points.get(n - 1).timestamp());

        if (TrendStats.constant(y)) {
            return pattern(metric, TrendType.STABLE, 1.0, 0.0, range);
        }

        double mean = TrendStats.mean(y);
        double slope = TrendStats.slope(y);
        double r2 = TrendStats.rSquared(y, slope);

        // 先看方向一致性：基準值很大、每天小幅上升的序列仍然是 INCREASING
        TrendType direction = slope > 0 ? TrendType.INCREASING : TrendType.DECREASING;
        double agreement = TrendStats.signAgreement(y, slope);
        if (agreement >= MONOTONIC_AGREEMENT) {
            return pattern(metric, direction, TrendStats.clamp01(Math.max(r2, agreement)), slope, range);
        }

        if (Math.abs(slope) * (n - 1) < STABLE_RELATIVE_DRIFT * Math.abs(mean)) {
            return pattern(metric, TrendType.STABLE, TrendStats.clamp01(1.0 - r2), slope, range);
        }

        double bestAuto = 0.0;
        for (int lag = 2; lag <= n / 2; lag++) {
            bestAuto = Math.max(bestAuto, TrendStats.autocorrelation(y, lag));
        }
        if (bestAuto >= CYCLICAL_AUTOCORRELATION) {
            return pattern(metric, TrendType.CYCLICAL, TrendStats.clamp01(bestAuto), slope, range);
        }

        double weak = Math.max(r2, agreement) * WEAK_TREND_DISCOUNT;
        return pattern(metric, direction, TrendStats.clamp01(weak), slope, range);
    }

    Change detectChange(LifestyleMetric metric,
                        List<MetricPoint> points,
                        Map<LifestyleMetric, List<MetricPoint>> series) {
        double[] y = TrendSeries.values(points);
        double baseline = baseline(y);
        if (points.size() < 2 || baseline == 0.0) return null;

        double latest = y[y.length - 1];
        double deviation = Math.abs(latest - baseline) / Math.abs(baseline);
        if (deviation <= CHANGE_THRESHOLD) return null;

        List<LifestyleMetric> causes = new ArrayList<>();
        for (Map.Entry<LifestyleMetric, List<MetricPoint>> e : series.entrySet()) {
            if (e.getKey() == metric) continue;
            OptionalDouble d = latestDeviation(e.getValue());
            if (d.isPresent() && d.getAsDouble() > CHANGE_THRESHOLD) causes.add(e.getKey());
        }

        double magnitude = latest - baseline;
        double pct = magnitude / Math.abs(baseline) * 100.0;
        String description = capitalize(metric.label()) + (magnitude > 0 ? " increased" : " decreased")
                + String.format(Locale.ROOT, " by %.0f%%", Math.abs(pct))
                + " compared with your average over the previous " + (y.length - 1) + " entries.";

        return new Change(metric, points.get(points.size() - 1).timestamp(),
                baseline, latest, magnitude, pct, description, causes);
    }

    private static OptionalDouble latestDeviation(List<MetricPoint> points) {
        if (points.size() < 2) return OptionalDouble.empty();
        double[] y = TrendSeries.values(points);
        double baseline = baseline(y);
        if (baseline == 0.0) return OptionalDouble.empty();
        return OptionalDouble.of(Math.abs(y[y.length - 1] - baseline) / Math.abs(baseline));
    }

    /** 最新一筆之前所有值的平均 */
    private static double baseline(double[] y) {
        if (y.length < 2) return 0.0;
        double s = 0.0;
        for (int i = 0; i < y.length - 1; i++) s += y[i];
        return s / (y.length - 1);
    }

    private Correlation correlate(LifestyleMetric a, List<MetricPoint> pa,
                                  LifestyleMetric b, List<MetricPoint> pb) {
        Map<LocalDate, Double> byDayA = byDay(pa);
        Map<LocalDate, Double> byDayB = byDay(pb);

        double bestR = 0.0;
        int bestLag = 0;
        double[][] bestPairs = null;

        for (int lag = 0; lag <= MAX_LAG_DAYS; lag++) {
            double[][] pairs = pairs(byDayA, byDayB, lag);
            if (pairs[0].length < MIN_CORRELATION_POINTS) continue;
            double r = TrendStats.pearson(pairs[0], pairs[1]);
            // 同樣強度取較小的 lag
            if (bestPairs == null || Math.abs(r) > Math.abs(bestR)) {
                bestR = r;
                bestLag = lag;
                bestPairs = pairs;
            }
        }

        if (bestPairs == null) {
            return new Correlation(a, b, 0.0, 0, 0, CausalityLevel.UNLIKELY,
                    "Not enough overlapping days to compare " + a.label() + " and " + b.label() + ".");
        }

        CausalityLevel causality = causality(bestR, bestPairs);
        return new Correlation(a, b, bestR, bestLag, bestPairs[0].length, causality,
                describe(a, b, bestR, bestLag));
    }

    private static CausalityLevel causality(double r, double[][] pairs) {
        double abs = Math.abs(r);
        if (abs >= LIKELY_R && consistentHalves(r, pairs)) return CausalityLevel.LIKELY;
        if (abs >= POSSIBLE_R) return CausalityLevel.POSSIBLE;
        return CausalityLevel.UNLIKELY;
    }

    /**
     * 前後兩半各自的 r 都與整體同號，才算穩定。
     */
    private static boolean consistentHalves(double r, double[][] pairs) {
        int n = pairs[0].length;
        int mid = n / 2;
        if (mid < 2 || n - mid < 2) return false;

        double first = TrendStats.pearson(slice(pairs[0], 0, mid), slice(pairs[1], 0, mid));
        double second = TrendStats.pearson(slice(pairs[0], mid, n), slice(pairs[1], mid, n));
        return Math.signum(first) == Math.signum(r) && Math.signum(second) == Math.signum(r);
    }

    private static double[][] pairs(Map<LocalDate, Double> a, Map<LocalDate, Double> b, int lag) {
        List<double[]> rows = new ArrayList<>();
        for (Map.Entry<LocalDate, Double> e : a.entrySet()) {
            Double vb = b.get(e.getKey().plusDays(lag));
            if (vb != null) rows.add(new double[]{e.getValue(), vb});
        }
        double[][] out = new double[2][rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            out[0][i] = rows.get(i)[0];
            out[1][i] = rows.get(i)[1];
        }
        return out;
    }

    /** 同一天多筆取最後一筆；保持時間順序 */
    private static Map<LocalDate, Double> byDay(List<MetricPoint> points) {
        Map<LocalDate, Double> out = new LinkedHashMap<>();
        for (MetricPoint p : points) out.put(p.timestamp().toLocalDate(), p.value());
        return out;
    }

    private static double[] slice(double[] v, int from, int to) {
        double[] out = new double[to - from];
        System.arraycopy(v, from, out, 0, out.length);
        return out;
    }

    private static Pattern pattern(LifestyleMetric metric, TrendType trend, double confidence,
                                   double slope, TimeRange range) {
        String description = String.format(Locale.ROOT, "Your %s shows a%s %s pattern over this period.",
                metric.label(),
                trend == TrendType.INCREASING ? "n" : "",
                trend.name().toLowerCase(Locale.ROOT));
        return new Pattern(metric, trend, confidence, slope, description, range);
    }

    private static String describe(LifestyleMetric a, LifestyleMetric b, double r, int lag) {
        String strength = Math.abs(r) >= LIKELY_R ? "strong" : Math.abs(r) >= POSSIBLE_R ? "moderate" : "weak";
        String direction = r > 0 ? "positive" : "negative";
        String when = lag == 0 ? "on the same day" : lag == 1 ? "one day later" : lag + " days later";
        return String.format(Locale.ROOT, "A %s %s link between %s and %s %s (r=%.2f).",
                strength, direction, a.label(), b.label(), when, r);
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
