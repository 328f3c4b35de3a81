package com.jeevanfit.backend.insight.model;

import com.jeevanfit.backend.bodytype.model.BodyTypeInsight;
import com.jeevanfit.backend.food.model.FoodClassification;
import com.jeevanfit.backend.sleep.model.SleepAnalysis;
import com.jeevanfit.backend.trend.model.TrendAnalysis;
import com.jeevanfit.backend.water.model.RetentionPrediction;

/**
 * 各分析器輸出的封閉聯集；新增分析器時 InsightGenerator 的 switch 會跟著要求補上。
 */
public sealed interface AnalysisResult {

    AnalysisSource source();

    double confidence();

    record FoodResult(FoodClassification classification) implements AnalysisResult {
        @Override public AnalysisSource source() { return AnalysisSource.FOOD; }
        @Override public double confidence() { return classification.confidence(); }
    }

    record RetentionResult(RetentionPrediction prediction) implements AnalysisResult {
        @Override public AnalysisSource source() { return AnalysisSource.WATER; }
        @Override public double confidence() { return prediction.confidence(); }
    }

    record SleepResult(SleepAnalysis analysis) implements AnalysisResult {
        @Override public AnalysisSource source() { return AnalysisSource.SLEEP; }
        @Override public double confidence() { return analysis.confidence(); }
    }

    record BodyTypeResult(BodyTypeInsight insight) implements AnalysisResult {
        @Override public AnalysisSource source() { return AnalysisSource.BODY_TYPE; }
        @Override public double confidence() { return insight.confidence(); }
    }

    record TrendResult(TrendAnalysis analysis) implements AnalysisResult {
        @Override public AnalysisSource source() { return AnalysisSource.TREND; }
        @Override public double confidence() { return analysis.confidence(); }
    }
}
