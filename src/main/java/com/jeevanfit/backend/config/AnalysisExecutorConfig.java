package com.jeevanfit.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AnalysisExecutorConfig {

    /**
     * ✅ 分析器 fan-out 專用的有界執行緒池
     * 關閉時等手上的工作做完（分析器都很快）
     */
    @Bean("analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor(PipelineProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.getCorePoolSize());
        ex.setMaxPoolSize(Math.max(props.getCorePoolSize(), props.getMaxPoolSize()));
        ex.setQueueCapacity(props.getQueueCapacity());
        ex.setThreadNamePrefix("analysis-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.setAwaitTerminationSeconds(5);
        ex.initialize();
        return ex;
    }

    /**
     * ✅ history 查詢獨立一個池：repository 卡住只會佔住這裡的 thread
     * 關閉時不等（卡住的查詢不該拖住 shutdown）
     */
    @Bean("historyExecutor")
    public ThreadPoolTaskExecutor historyExecutor(PipelineProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.getHistoryPoolSize());
        ex.setMaxPoolSize(props.getHistoryPoolSize());
        ex.setQueueCapacity(props.getHistoryQueueCapacity());
        ex.setThreadNamePrefix("history-");
        ex.setWaitForTasksToCompleteOnShutdown(false);
        ex.initialize();
        return ex;
    }
}
