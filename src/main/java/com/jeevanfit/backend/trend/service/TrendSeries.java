package com.jeevanfit.backend.trend.service;

import com.jeevanfit.backend.lifestyle.model.LifestyleRecord;
import com.jeevanfit.backend.trend.model.LifestyleMetric;
import com.jeevanfit.backend.trend.model.MetricPoint;
import com.jeevanfit.backend.trend.model.TimeRange;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 紀錄 → 每個指標的時間序列。輸入 list 不會被修改（先複製再排序）。
 */
final class TrendSeries {

    private TrendSeries() {}

    static List<LifestyleRecord> inRange(List<LifestyleRecord> history, TimeRange range) {
        if (history == null) return List.of();
        List<LifestyleRecord> out = new ArrayList<>();
        for (LifestyleRecord r : history) {
            if (r == null || r.timestamp() == null) continue;
            if (range == null || range.contains(r.timestamp())) out.add(r);
        }
        out.sort(Comparator.comparing(LifestyleRecord::timestamp));
        return out;
    }

    static List<MetricPoint> points(List<LifestyleRecord> history, LifestyleMetric metric, TimeRange range) {
        List<MetricPoint> out = new ArrayList<>();
        for (LifestyleRecord r : inRange(history, range)) {
            Double v = metric.extract(r);
            if (v != null && !v.isNaN()) out.add(new MetricPoint(r.timestamp(), v));
        }
        return out;
    }

    static Map<LifestyleMetric, List<MetricPoint>> all(List<LifestyleRecord> history, TimeRange range) {
        Map<LifestyleMetric, List<MetricPoint>> out = new EnumMap<>(LifestyleMetric.class);
        for (LifestyleMetric m : LifestyleMetric.values()) {
            out.put(m, points(history, m, range));
        }
        return out;
    }

    static double[] values(List<MetricPoint> points) {
        double[] v = new double[points.size()];
        for (int i = 0; i < v.length; i++) v[i] = points.get(i).value();
        return v;
    }
}
