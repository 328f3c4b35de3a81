package com.jeevanfit.backend.pipeline;

import com.jeevanfit.backend.common.AnalysisError;
import com.jeevanfit.backend.education.model.EducationalContent;
import com.jeevanfit.backend.insight.model.Insight;
import com.jeevanfit.backend.lifestyle.model.BodyTypeClassification;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 交給儲存層 / 呈現層的最終結果（Jackson 可直接序列化）。
 * notices：降級說明（資料不足、history 不可用…），沒有時為空 list。
 */
public record PipelineResult(
        String userId,
        LocalDateTime generatedAt,
        BodyTypeClassification bodyType,
        List<Insight> insights,
        List<EducationalContent> educationalContent,
        List<AnalysisError> notices
) {
    public PipelineResult {
        insights = List.copyOf(insights);
        educationalContent = List.copyOf(educationalContent);
        notices = List.copyOf(notices);
    }
}
