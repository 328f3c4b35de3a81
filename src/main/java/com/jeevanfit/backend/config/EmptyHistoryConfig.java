package com.jeevanfit.backend.config;

import com.jeevanfit.backend.trend.service.HistoryRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 儲存層不在本模組內；沒有人提供 HistoryRepository 時，用空歷史讓 pipeline 照常運作（趨勢會帶資料不足的 notice）。
 */
@Configuration
public class EmptyHistoryConfig {

    @Bean
    @ConditionalOnMissingBean(HistoryRepository.class)
    public HistoryRepository emptyHistoryRepository() {
        return (userId, range) -> List.of();
    }
}
