package com.jeevanfit.backend.pipeline;

import com.jeevanfit.backend.bodytype.service.BodyTypeAnalyzer;
import com.jeevanfit.backend.common.AnalysisError;
import com.jeevanfit.backend.common.AnalysisFailedException;
import com.jeevanfit.backend.common.AnalysisValidationException;
import com.jeevanfit.backend.common.CollaboratorUnavailableException;
import com.jeevanfit.backend.common.ErrorKind;
import com.jeevanfit.backend.config.PipelineProperties;
import com.jeevanfit.backend.education.service.EducationalContentEngine;
import com.jeevanfit.backend.food.service.FoodClassifier;
import com.jeevanfit.backend.insight.model.Insight;
import com.jeevanfit.backend.insight.model.InsightPriority;
import com.jeevanfit.backend.insight.service.InsightGenerator;
import com.jeevanfit.backend.lifestyle.model.BodyTypeClassification;
import com.jeevanfit.backend.lifestyle.model.LifestyleRecord;
import com.jeevanfit.backend.lifestyle.model.SleepData;
import com.jeevanfit.backend.sleep.service.SleepAnalyzer;
import com.jeevanfit.backend.trend.model.TimeRange;
import com.jeevanfit.backend.trend.service.HistoryRepository;
import com.jeevanfit.backend.trend.service.TrendAnalyzer;
import com.jeevanfit.backend.water.service.WaterRetentionPredictor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static com.jeevanfit.backend.testsupport.Fixtures.DAY;
import static com.jeevanfit.backend.testsupport.Fixtures.day;
import static com.jeevanfit.backend.testsupport.Fixtures.meal;
import static com.jeevanfit.backend.testsupport.Fixtures.record;
import static com.jeevanfit.backend.testsupport.Fixtures.sleep;
import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;

class LifestyleInsightPipelineTest {

    private ExecutorService executor;
    private ExecutorService historyExecutor;
    private HistoryRepository repo;
    private PipelineProperties props;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        historyExecutor = Executors.newFixedThreadPool(2);
        repo = Mockito.mock(HistoryRepository.class);
        props = new PipelineProperties();
        props.setHistoryTimeout(Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        historyExecutor.shutdownNow();
    }

    private LifestyleInsightPipeline pipeline() {
        return pipeline(new FoodClassifier(), executor, historyExecutor);
    }

    private LifestyleInsightPipeline pipeline(FoodClassifier foodClassifier, Executor analysis, Executor history) {
        return new LifestyleInsightPipeline(
                foodClassifier,
                new WaterRetentionPredictor(),
                new SleepAnalyzer(),
                new BodyTypeAnalyzer(),
                new TrendAnalyzer(),
                new InsightGenerator(),
                new EducationalContentEngine(),
                repo,
                props,
                new PipelineTelemetry(),
                analysis,
                history
        );
    }

    private static LifestyleRecord saltyDay() {
        return record(List.of(meal(900)), 500, sleep(7.0, 3));
    }

    @Test
    void salty_dehydrated_day_surfaces_high_retention_insight() {
        Mockito.when(repo.fetchRecords(eq("u1"), any())).thenReturn(List.of());

        PipelineResult result = pipeline().run(saltyDay(), BodyTypeClassification.MESOMORPH, null);

        assertThat(result.userId()).isEqualTo("u1");
        assertThat(result.bodyType()).isEqualTo(BodyTypeClassification.MESOMORPH);
        assertThat(result.insights()).anySatisfy(i -> {
            assertThat(i.title()).isEqualTo("Water retention: high");
            assertThat(i.priority()).isEqualTo(InsightPriority.HIGH);
        });
        assertThat(result.insights().get(0).priority()).isEqualTo(InsightPriority.HIGH);
        // 每個 insight 都有對應的教育內容
        assertThat(result.educationalContent()).hasSameSizeAs(result.insights());
        assertThat(result.educationalContent()).allSatisfy(c -> assertThat(c.disclaimer()).isNotBlank());
        assertThat(result.insights()).allSatisfy(i -> assertThat(i.rationale()).isNotEmpty());
        // 只有今天一筆 → 趨勢資料不足
        assertThat(result.notices()).extracting(AnalysisError::kind).containsExactly(ErrorKind.PROCESSING);
    }

    @Test
    void week_of_history_produces_trend_insights_without_notices() {
        List<LifestyleRecord> week = new ArrayList<>();
        for (int i = 0; i < 7; i++) week.add(day(i, 100 + i * 100, 2000));
        Mockito.when(repo.fetchRecords(eq("u1"), any())).thenReturn(week);

        LifestyleRecord today = week.get(6);
        TimeRange range = new TimeRange(DAY.minusDays(1), DAY.plusDays(7));

        PipelineResult result = pipeline().run(today, BodyTypeClassification.ENDOMORPH, range);

        assertThat(result.notices()).isEmpty();
        assertThat(result.insights()).extracting(Insight::title)
                .contains("Change in sodium", "Sodium is increasing");
        Mockito.verify(repo).fetchRecords("u1", range);
    }

    @Test
    void slow_history_degrades_to_a_system_notice() {
        props.setHistoryTimeout(Duration.ofMillis(50));
        Mockito.when(repo.fetchRecords(any(), any())).thenAnswer(inv -> {
            Thread.sleep(1_000);
            return List.of();
        });

        PipelineResult result = pipeline().run(saltyDay(), BodyTypeClassification.MESOMORPH, null);

        assertThat(result.notices()).singleElement().satisfies(n -> {
            assertThat(n.kind()).isEqualTo(ErrorKind.SYSTEM);
            assertThat(n.message()).isEqualTo(CollaboratorUnavailableException.USER_MESSAGE);
            assertThat(n.recoverySuggestion()).isNotBlank();
        });
        // 今天的分析照常產出
        assertThat(result.insights()).extracting(Insight::title).contains("Water retention: high");
    }

    @Test
    void slow_history_fails_the_run_when_configured() {
        props.setHistoryTimeout(Duration.ofMillis(50));
        props.setFailOnHistoryError(true);
        Mockito.when(repo.fetchRecords(any(), any())).thenAnswer(inv -> {
            Thread.sleep(1_000);
            return List.of();
        });

        assertThatThrownBy(() -> pipeline().run(saltyDay(), BodyTypeClassification.MESOMORPH, null))
                .isInstanceOf(CollaboratorUnavailableException.class)
                .hasMessage(CollaboratorUnavailableException.USER_MESSAGE);
    }

    @Test
    void failing_history_does_not_leak_details() {
        Mockito.when(repo.fetchRecords(any(), any())).thenThrow(new IllegalStateException("db password=secret"));

        PipelineResult result = pipeline().run(saltyDay(), BodyTypeClassification.MESOMORPH, null);

        assertThat(result.notices()).singleElement().satisfies(n -> {
            assertThat(n.kind()).isEqualTo(ErrorKind.SYSTEM);
            assertThat(n.message()).doesNotContain("secret");
        });
    }

    @Test
    void missing_sleep_quality_fails_validation() {
        Mockito.when(repo.fetchRecords(any(), any())).thenReturn(List.of());
        SleepData broken = new SleepData(7.0, null, LocalTime.of(23, 0), null, 0);
        LifestyleRecord r = record(List.of(meal(400)), 2000, broken);

        assertThatThrownBy(() -> pipeline().run(r, BodyTypeClassification.MESOMORPH, null))
                .isInstanceOf(AnalysisValidationException.class)
                .hasMessage("MISSING_FIELD: sleep.quality");
    }

    @Test
    void missing_sleep_adds_a_notice_and_skips_sleep_insights() {
        props.setTrendsEnabled(false);
        LifestyleRecord r = record(List.of(meal(400)), 2000, null);

        PipelineResult result = pipeline().run(r, null, null);

        assertThat(result.bodyType()).isEqualTo(BodyTypeClassification.MIXED);
        assertThat(result.notices()).singleElement()
                .extracting(AnalysisError::message).isEqualTo("SLEEP_NOT_LOGGED");
        assertThat(result.insights()).extracting(Insight::title).noneMatch(t -> t.startsWith("Sleep"));
    }

    @Test
    void disabled_trends_never_touch_the_repository() {
        props.setTrendsEnabled(false);

        PipelineResult result = pipeline().run(saltyDay(), BodyTypeClassification.MESOMORPH, null);

        Mockito.verifyNoInteractions(repo);
        assertThat(result.notices()).isEmpty();
    }

    @Test
    void null_record_is_rejected() {
        assertThatThrownBy(() -> pipeline().run(null, BodyTypeClassification.MESOMORPH, null))
                .isInstanceOf(AnalysisValidationException.class);
        Mockito.verifyNoInteractions(repo);
    }

    @Test
    void hung_history_never_starves_the_analyzers() {
        ExecutorService small = Executors.newFixedThreadPool(2);
        CountDownLatch release = new CountDownLatch(1);
        props.setHistoryTimeout(Duration.ofMillis(100));
        Mockito.when(repo.fetchRecords(any(), any())).thenAnswer(inv -> {
            release.await();
            return List.of();
        });
        LifestyleInsightPipeline p = pipeline(new FoodClassifier(), small, historyExecutor);

        try {
            // history 的 thread 全卡住之後，第 3、4 次照樣在時限內回來
            for (int run = 0; run < 4; run++) {
                PipelineResult result = assertTimeoutPreemptively(Duration.ofSeconds(5),
                        () -> p.run(saltyDay(), BodyTypeClassification.MESOMORPH, null));

                assertThat(result.notices()).extracting(AnalysisError::kind).containsExactly(ErrorKind.SYSTEM);
                assertThat(result.insights()).extracting(Insight::title).contains("Water retention: high");
            }
        } finally {
            release.countDown();
            small.shutdownNow();
        }
    }

    @Test
    void rejected_history_fetch_degrades_to_a_system_notice() {
        Executor full = task -> {
            throw new RejectedExecutionException("queue full");
        };

        PipelineResult result = pipeline(new FoodClassifier(), executor, full)
                .run(saltyDay(), BodyTypeClassification.MESOMORPH, null);

        assertThat(result.notices()).singleElement().satisfies(n -> {
            assertThat(n.kind()).isEqualTo(ErrorKind.SYSTEM);
            assertThat(n.message()).isEqualTo(CollaboratorUnavailableException.USER_MESSAGE);
        });
        Mockito.verifyNoInteractions(repo);
    }

    @Test
    void unexpected_analyzer_failure_becomes_a_system_error() {
        props.setTrendsEnabled(false);
        FoodClassifier broken = Mockito.mock(FoodClassifier.class);
        Mockito.when(broken.classify(any())).thenThrow(new IllegalStateException("index 7 out of bounds"));

        assertThatThrownBy(() -> pipeline(broken, executor, historyExecutor)
                .run(saltyDay(), BodyTypeClassification.MESOMORPH, null))
                .isInstanceOfSatisfying(AnalysisFailedException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.SYSTEM);
                    assertThat(e.errorCode()).isEqualTo("ANALYZER_FAILED");
                    assertThat(e.getMessage()).isEqualTo(AnalysisFailedException.USER_MESSAGE);
                    assertThat(e.recoverySuggestion()).isNotBlank();
                    assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                });
    }

    @Test
    void full_analyzer_pool_becomes_a_system_error() {
        Executor full = task -> {
            throw new RejectedExecutionException("queue full");
        };

        assertThatThrownBy(() -> pipeline(new FoodClassifier(), full, historyExecutor)
                .run(saltyDay(), BodyTypeClassification.MESOMORPH, null))
                .isInstanceOfSatisfying(AnalysisFailedException.class, e -> {
                    assertThat(e.errorCode()).isEqualTo("ANALYZER_REJECTED");
                    assertThat(e.toError().kind()).isEqualTo(ErrorKind.SYSTEM);
                });
        Mockito.verifyNoInteractions(repo);
    }

    @Test
    void analyzers_that_never_finish_time_out() {
        props.setTrendsEnabled(false);
        props.setAnalysisTimeout(Duration.ofMillis(100));
        // 收了工作但永遠不執行
        Executor stuck = task -> { };

        assertThatThrownBy(() -> pipeline(new FoodClassifier(), stuck, historyExecutor)
                .run(saltyDay(), BodyTypeClassification.MESOMORPH, null))
                .isInstanceOfSatisfying(AnalysisFailedException.class,
                        e -> assertThat(e.errorCode()).isEqualTo("ANALYZER_TIMEOUT"));
    }
}
