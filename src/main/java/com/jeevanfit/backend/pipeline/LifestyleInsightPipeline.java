package com.jeevanfit.backend.pipeline;

import com.jeevanfit.backend.bodytype.service.BodyTypeAnalyzer;
import com.jeevanfit.backend.common.AnalysisError;
import com.jeevanfit.backend.common.AnalysisException;
import com.jeevanfit.backend.common.AnalysisFailedException;
import com.jeevanfit.backend.common.AnalysisValidationException;
import com.jeevanfit.backend.common.CollaboratorUnavailableException;
import com.jeevanfit.backend.config.PipelineProperties;
import com.jeevanfit.backend.education.model.EducationalContent;
import com.jeevanfit.backend.education.service.EducationalContentEngine;
import com.jeevanfit.backend.food.service.FoodClassifier;
import com.jeevanfit.backend.insight.model.AnalysisResult;
import com.jeevanfit.backend.insight.model.Insight;
import com.jeevanfit.backend.insight.service.InsightGenerator;
import com.jeevanfit.backend.lifestyle.model.BodyTypeClassification;
import com.jeevanfit.backend.lifestyle.model.FoodItem;
import com.jeevanfit.backend.lifestyle.model.LifestyleRecord;
import com.jeevanfit.backend.sleep.service.SleepAnalyzer;
import com.jeevanfit.backend.trend.model.TimeRange;
import com.jeevanfit.backend.trend.service.HistoryRepository;
import com.jeevanfit.backend.trend.service.TrendAnalyzer;
import com.jeevanfit.backend.water.service.WaterRetentionPredictor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 單筆紀錄的完整流程：
 * 1) food / water / sleep / bodyType 四個分析器丟到 analysisExecutor 平行跑
 * 2) 同時在 historyExecutor 查 history（有 timeout），成功才跑 TrendAnalyzer
 * 3) 全部 join（有 timeout）後 → InsightGenerator → EducationalContentEngine
 * 任何 VALIDATION 錯誤直接往外丟；history 失敗依設定降級成 notice 或往外丟；
 * 分析器非預期失敗 / 池滿 / 逾時一律轉成 AnalysisFailedException（SYSTEM）。
 */
@Slf4j
@Service
public class LifestyleInsightPipeline {

    private final FoodClassifier foodClassifier;
    private final WaterRetentionPredictor waterRetentionPredictor;
    private final SleepAnalyzer sleepAnalyzer;
    private final BodyTypeAnalyzer bodyTypeAnalyzer;
    private final TrendAnalyzer trendAnalyzer;
    private final InsightGenerator insightGenerator;
    private final EducationalContentEngine educationalContentEngine;
    private final HistoryRepository historyRepository;
    private final PipelineProperties props;
    private final PipelineTelemetry telemetry;
    private final Executor executor;
    private final Executor historyExecutor;

    public LifestyleInsightPipeline(
            FoodClassifier foodClassifier,
            WaterRetentionPredictor waterRetentionPredictor,
            SleepAnalyzer sleepAnalyzer,
            BodyTypeAnalyzer bodyTypeAnalyzer,
            TrendAnalyzer trendAnalyzer,
            InsightGenerator insightGenerator,
            EducationalContentEngine educationalContentEngine,
            HistoryRepository historyRepository,
            PipelineProperties props,
            PipelineTelemetry telemetry,
            @Qualifier("analysisExecutor") Executor executor,
            @Qualifier("historyExecutor") Executor historyExecutor
    ) {
        this.foodClassifier = foodClassifier;
        this.waterRetentionPredictor = waterRetentionPredictor;
        this.sleepAnalyzer = sleepAnalyzer;
        this.bodyTypeAnalyzer = bodyTypeAnalyzer;
        this.trendAnalyzer = trendAnalyzer;
        this.insightGenerator = insightGenerator;
        this.educationalContentEngine = educationalContentEngine;
        this.historyRepository = historyRepository;
        this.props = props;
        this.telemetry = telemetry;
        this.executor = executor;
        this.historyExecutor = historyExecutor;
    }

    public PipelineResult run(LifestyleRecord record, BodyTypeClassification bodyType, TimeRange range) {
        if (record == null) {
            throw new AnalysisValidationException("record", "Provide today's lifestyle record.");
        }
        long t0 = System.nanoTime();
        BodyTypeClassification bt = (bodyType == null) ? BodyTypeClassification.MIXED : bodyType;
        List<AnalysisError> notices = new ArrayList<>();

        List<CompletableFuture<?>> all = new ArrayList<>(4);
        CompletableFuture<List<AnalysisResult>> foodF;
        CompletableFuture<AnalysisResult> waterF;
        CompletableFuture<AnalysisResult> sleepF;
        CompletableFuture<AnalysisResult> bodyF;
        try {
            foodF = CompletableFuture.supplyAsync(() -> classifyFoods(record), executor);
            all.add(foodF);
            waterF = CompletableFuture.supplyAsync(
                    () -> new AnalysisResult.RetentionResult(waterRetentionPredictor.predict(record, bt)), executor);
            all.add(waterF);
            sleepF = (record.sleep() == null)
                    ? CompletableFuture.completedFuture(null)
                    : CompletableFuture.supplyAsync(
                    () -> new AnalysisResult.SleepResult(sleepAnalyzer.analyze(record.sleep(), record)), executor);
            all.add(sleepF);
            bodyF = CompletableFuture.supplyAsync(
                    () -> new AnalysisResult.BodyTypeResult(bodyTypeAnalyzer.analyze(bt, record)), executor);
            all.add(bodyF);
        } catch (RejectedExecutionException e) {
            // TaskRejectedException 也是 RejectedExecutionException
            cancel(all);
            throw failed(record.userId(), "ANALYZER_REJECTED", e, t0);
        }

        if (record.sleep() == null) {
            notices.add(AnalysisError.processing("SLEEP_NOT_LOGGED",
                    "Log last night's sleep to see how your habits affect it."));
        }

        AnalysisResult.TrendResult trend = null;
        try {
            if (props.isTrendsEnabled()) {
                TimeRange window = (range != null) ? range : defaultRange(record);
                List<LifestyleRecord> history = loadHistory(record.userId(), window);
                trend = new AnalysisResult.TrendResult(trendAnalyzer.analyzeTrends(withToday(history, record), window));
            }
        } catch (CollaboratorUnavailableException e) {
            if (props.isFailOnHistoryError()) {
                cancel(all);
                telemetry.fail(record.userId(), e.kind().name(), "HISTORY_UNAVAILABLE", elapsedMs(t0));
                throw e;
            }
            notices.add(e.toError());
        }

        awaitAnalyzers(record.userId(), all, t0);
        List<AnalysisResult> results = new ArrayList<>();
        results.addAll(foodF.join());
        results.add(waterF.join());
        if (sleepF.join() != null) results.add(sleepF.join());
        results.add(bodyF.join());
        if (trend != null) {
            if (trend.analysis().notice() != null) notices.add(trend.analysis().notice());
            results.add(trend);
        }

        List<Insight> insights = insightGenerator.generate(results);
        List<EducationalContent> content = new ArrayList<>(insights.size());
        for (Insight insight : insights) {
            content.add(educationalContentEngine.translate(insight));
        }

        telemetry.ok(record.userId(), insights.size(), notices.size(), elapsedMs(t0));
        return new PipelineResult(record.userId(), LocalDateTime.now(), bt, insights, content, notices);
    }

    /**
     * 單一同步呼叫點：逾時或例外都轉成 CollaboratorUnavailableException（細節只進 log）。
     */
    public List<LifestyleRecord> loadHistory(String userId, TimeRange range) {
        long t0 = System.nanoTime();
        CompletableFuture<List<LifestyleRecord>> f;
        try {
            f = CompletableFuture.supplyAsync(() -> historyRepository.fetchRecords(userId, range), historyExecutor);
        } catch (RejectedExecutionException e) {
            telemetry.historyFail(userId, "REJECTED", elapsedMs(t0), e);
            throw new CollaboratorUnavailableException("history", e);
        }
        try {
            List<LifestyleRecord> records = f.get(props.getHistoryTimeout().toMillis(), TimeUnit.MILLISECONDS);
            List<LifestyleRecord> out = (records == null) ? List.of() : records;
            telemetry.historyOk(userId, out.size(), elapsedMs(t0));
            return out;
        } catch (TimeoutException e) {
            f.cancel(true);
            telemetry.historyFail(userId, "TIMEOUT", elapsedMs(t0), e);
            throw new CollaboratorUnavailableException("history", e);
        } catch (ExecutionException e) {
            telemetry.historyFail(userId, "FETCH_FAILED", elapsedMs(t0), e.getCause());
            throw new CollaboratorUnavailableException("history", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            telemetry.historyFail(userId, "INTERRUPTED", elapsedMs(t0), e);
            throw new CollaboratorUnavailableException("history", e);
        }
    }

    private List<AnalysisResult> classifyFoods(LifestyleRecord record) {
        List<AnalysisResult> out = new ArrayList<>(record.foods().size());
        for (FoodItem item : record.foods()) {
            if (item == null) continue;
            out.add(new AnalysisResult.FoodResult(foodClassifier.classify(item)));
        }
        return out;
    }

    private TimeRange defaultRange(LifestyleRecord record) {
        LocalDateTime end = (record.timestamp() != null) ? record.timestamp() : LocalDateTime.now();
        return TimeRange.lastDays(end, props.getTrendWindowDays());
    }

    /** history 是唯讀的；今天的紀錄還沒存進去時，另外複製一份 list 補上 */
    private static List<LifestyleRecord> withToday(List<LifestyleRecord> history, LifestyleRecord today) {
        if (today.timestamp() == null) return history;
        boolean present = history.stream()
                .anyMatch(r -> r != null && Objects.equals(r.timestamp(), today.timestamp()));
        if (present) return history;
        List<LifestyleRecord> merged = new ArrayList<>(history.size() + 1);
        merged.addAll(history);
        merged.add(today);
        return merged;
    }

    /**
     * 等四個分析器，上限 analysisTimeout。
     * AnalysisException 原樣往外丟；其他例外 / 逾時 → AnalysisFailedException。
     */
    private void awaitAnalyzers(String userId, List<CompletableFuture<?>> all, long t0) {
        try {
            CompletableFuture.allOf(all.toArray(new CompletableFuture<?>[0]))
                    .get(props.getAnalysisTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            cancel(all);
            Throwable cause = e.getCause();
            while (cause instanceof CompletionException && cause.getCause() != null) cause = cause.getCause();
            if (cause instanceof AnalysisException ae) {
                telemetry.fail(userId, ae.kind().name(), ae.getMessage(), elapsedMs(t0));
                throw ae;
            }
            throw failed(userId, "ANALYZER_FAILED", cause, t0);
        } catch (TimeoutException e) {
            cancel(all);
            throw failed(userId, "ANALYZER_TIMEOUT", e, t0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(all);
            throw failed(userId, "INTERRUPTED", e, t0);
        }
    }

    private AnalysisFailedException failed(String userId, String errorCode, Throwable cause, long t0) {
        log.error("analyzer failed unexpectedly userId={} errorCode={}", userId, errorCode, cause);
        AnalysisFailedException ex = new AnalysisFailedException(errorCode, cause);
        telemetry.fail(userId, ex.kind().name(), errorCode, elapsedMs(t0));
        return ex;
    }

    private static void cancel(List<CompletableFuture<?>> futures) {
        for (CompletableFuture<?> f : futures) f.cancel(true);
    }

    private static long elapsedMs(long t0) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
    }
}
