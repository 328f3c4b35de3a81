package com.jeevanfit.backend.trend.service;

import com.jeevanfit.backend.lifestyle.model.LifestyleRecord;
import com.jeevanfit.backend.trend.model.LifestyleMetric;
import com.jeevanfit.backend.trend.model.MetricPoint;
import com.jeevanfit.backend.trend.model.TimeRange;

import java.util.List;

/**
 * 歷史紀錄的唯讀查詢（儲存層在本專案之外）。
 * 實作可以很慢或失敗；呼叫端負責 timeout。
 */
public interface HistoryRepository {

    List<LifestyleRecord> fetchRecords(String userId, TimeRange range);

    default List<MetricPoint> fetch(String userId, LifestyleMetric metric, TimeRange range) {
        return TrendSeries.points(fetchRecords(userId, range), metric, range);
    }
}
