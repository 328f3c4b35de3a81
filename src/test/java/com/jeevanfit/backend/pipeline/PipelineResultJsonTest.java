package com.jeevanfit.backend.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jeevanfit.backend.common.AnalysisError;
import com.jeevanfit.backend.education.model.CauseEffectPair;
import com.jeevanfit.backend.education.model.EducationalContent;
import com.jeevanfit.backend.education.model.EvidenceLevel;
import com.jeevanfit.backend.insight.model.AnalysisSource;
import com.jeevanfit.backend.insight.model.Insight;
import com.jeevanfit.backend.insight.model.InsightCategory;
import com.jeevanfit.backend.insight.model.InsightPriority;
import com.jeevanfit.backend.lifestyle.model.BodyTypeClassification;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jeevanfit.backend.testsupport.Fixtures.DAY;
import static org.assertj.core.api.Assertions.assertThat;

class PipelineResultJsonTest {

    // ✅ LocalDateTime 需要 jsr310 module
    private final ObjectMapper om = new ObjectMapper().findAndRegisterModules();

    @Test
    void result_serialization_contains_expected_fields() throws Exception {
        Insight insight = new Insight(
                "Water retention: high",
                "Your habits point to high water retention today, mainly from sodium.",
                "detail",
                InsightPriority.HIGH,
                InsightCategory.HYDRATION,
                true,
                true,
                List.of(),
                AnalysisSource.WATER,
                0.85,
                List.of("High sodium intake (900mg) leads the body to hold extra water to keep its salt balance.")
        );
        EducationalContent content = new EducationalContent(
                "Water retention: high",
                InsightCategory.HYDRATION,
                "main",
                "explanation",
                List.of(new CauseEffectPair("High sodium intake", "Extra water held in the body",
                        "The body retains water to dilute extra sodium.", EvidenceLevel.WELL_ESTABLISHED)),
                "disclaimer text"
        );
        PipelineResult result = new PipelineResult("u1", DAY, BodyTypeClassification.MESOMORPH,
                List.of(insight), List.of(content),
                List.of(AnalysisError.processing("INSUFFICIENT_HISTORY: 1 of 7 days available", "Keep logging daily.")));

        String json = om.writeValueAsString(result);

        assertThat(json).contains("\"userId\"");
        assertThat(json).contains("\"insights\"");
        assertThat(json).contains("\"educationalContent\"");
        assertThat(json).contains("\"notices\"");

        // ✅ 使用者看得到的欄位硬驗收
        assertThat(json).contains("\"rationale\"");
        assertThat(json).contains("\"disclaimer\"");
        assertThat(json).contains("\"causeEffect\"");
        assertThat(json).contains("\"recoverySuggestion\"");
        assertThat(json).contains("\"WELL_ESTABLISHED\"");
    }
}
