package com.jeevanfit.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * application.yml:
 * app.pipeline.*
 */
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    /** history repository 單次查詢上限；逾時視為 collaborator 不可用 */
    @NotNull
    private Duration historyTimeout = Duration.ofSeconds(2);

    /** 四個分析器合計的等待上限；超過視為系統錯誤 */
    @NotNull
    private Duration analysisTimeout = Duration.ofSeconds(5);

    /** 呼叫端沒給 range 時，往回看幾天 */
    @Min(7)
    private int trendWindowDays = 30;

    /** 一鍵開關：關掉就不查 history、不產生趨勢 */
    private boolean trendsEnabled = true;

    /** true：history 失敗直接丟 CollaboratorUnavailableException；false：降級成 notice */
    private boolean failOnHistoryError = false;

    @Min(1)
    private int corePoolSize = 4;

    @Min(1)
    private int maxPoolSize = 8;

    @Min(0)
    private int queueCapacity = 100;

    /** history 查詢獨立的池，卡住的 repository 不會吃掉分析器的 thread */
    @Min(1)
    private int historyPoolSize = 2;

    @Min(0)
    private int historyQueueCapacity = 10;

    // ===== getters/setters =====
    public Duration getHistoryTimeout() { return historyTimeout; }
    public void setHistoryTimeout(Duration historyTimeout) { this.historyTimeout = historyTimeout; }

    public Duration getAnalysisTimeout() { return analysisTimeout; }
    public void setAnalysisTimeout(Duration analysisTimeout) { this.analysisTimeout = analysisTimeout; }

    public int getTrendWindowDays() { return trendWindowDays; }
    public void setTrendWindowDays(int trendWindowDays) { this.trendWindowDays = trendWindowDays; }

    public boolean isTrendsEnabled() { return trendsEnabled; }
    public void setTrendsEnabled(boolean trendsEnabled) { this.trendsEnabled = trendsEnabled; }

    public boolean isFailOnHistoryError() { return failOnHistoryError; }
    public void setFailOnHistoryError(boolean failOnHistoryError) { this.failOnHistoryError = failOnHistoryError; }

    public int getCorePoolSize() { return corePoolSize; }
    public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }

    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }

    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

    public int getHistoryPoolSize() { return historyPoolSize; }
    public void setHistoryPoolSize(int historyPoolSize) { this.historyPoolSize = historyPoolSize; }

    public int getHistoryQueueCapacity() { return historyQueueCapacity; }
    public void setHistoryQueueCapacity(int historyQueueCapacity) { this.historyQueueCapacity = historyQueueCapacity; }
}
