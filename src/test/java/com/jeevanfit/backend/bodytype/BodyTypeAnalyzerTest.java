package com.jeevanfit.backend.bodytype;

import com.jeevanfit.backend.bodytype.model.BodyTypeInsight;
import com.jeevanfit.backend.bodytype.model.MetabolicProfile;
import com.jeevanfit.backend.bodytype.model.MetabolicRate;
import com.jeevanfit.backend.bodytype.model.NutritionalNeeds;
import com.jeevanfit.backend.bodytype.service.BodyTypeAnalyzer;
import com.jeevanfit.backend.common.AnalysisValidationException;
import com.jeevanfit.backend.common.Recommendation;
import com.jeevanfit.backend.lifestyle.model.BodyTypeClassification;
import com.jeevanfit.backend.lifestyle.model.FoodItem;
import com.jeevanfit.backend.lifestyle.model.LifestyleRecord;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.jeevanfit.backend.testsupport.Fixtures.meal;
import static com.jeevanfit.backend.testsupport.Fixtures.nutrition;
import static com.jeevanfit.backend.testsupport.Fixtures.record;
import static org.assertj.core.api.Assertions.*;

class BodyTypeAnalyzerTest {

    private final BodyTypeAnalyzer analyzer = new BodyTypeAnalyzer();

    @Test
    void every_body_type_gets_a_complete_insight() {
        LifestyleRecord r = record(List.of(meal(400)), 2200, null);

        for (BodyTypeClassification bt : BodyTypeClassification.values()) {
            BodyTypeInsight i = analyzer.analyze(bt, r);

            assertThat(i.bodyType()).isEqualTo(bt);
            assertThat(i.metabolicResponse()).isNotBlank();
            assertThat(i.fatStoragePattern()).isNotBlank();
            assertThat(i.energyUtilization()).isNotBlank();
            assertThat(i.nutritionalNeeds().mealFrequency()).isNotBlank();
            assertThat(i.nutritionalNeeds().hydrationGuidance()).isNotBlank();
            assertThat(i.recommendations()).isNotEmpty();
            assertThat(i.observations()).isNotEmpty();
        }
    }

    @Test
    void macro_ratios_sum_to_100_and_differ_between_pure_types() {
        LifestyleRecord r = record(List.of(), 2200, null);
        Set<List<Double>> seen = new HashSet<>();

        for (BodyTypeClassification bt : BodyTypeClassification.values()) {
            NutritionalNeeds n = analyzer.analyze(bt, r).nutritionalNeeds();
            assertThat(n.proteinRatio() + n.carbRatio() + n.fatRatio()).isCloseTo(100.0, within(1e-9));
            seen.add(List.of(n.proteinRatio(), n.carbRatio(), n.fatRatio()));
        }
        assertThat(seen).hasSize(BodyTypeClassification.values().length);
    }

    @Test
    void endomorph_is_most_carb_sensitive_and_slow() {
        MetabolicProfile ecto = analyzer.getMetabolicProfile(BodyTypeClassification.ECTOMORPH);
        MetabolicProfile endo = analyzer.getMetabolicProfile(BodyTypeClassification.ENDOMORPH);

        assertThat(ecto.baseMetabolicRate()).isEqualTo(MetabolicRate.FAST);
        assertThat(endo.baseMetabolicRate()).isEqualTo(MetabolicRate.SLOW);
        assertThat(endo.carbSensitivity()).isGreaterThan(ecto.carbSensitivity());
        assertThat(endo.fatStorageTendency()).isGreaterThan(ecto.fatStorageTendency());
    }

    @Test
    void mixed_profile_is_the_average_of_the_pure_types() {
        MetabolicProfile mixed = analyzer.getMetabolicProfile(BodyTypeClassification.MIXED);

        // (3 + 5 + 8) / 3
        assertThat(mixed.carbSensitivity()).isCloseTo(16.0 / 3.0, within(1e-9));
        assertThat(mixed.baseMetabolicRate()).isEqualTo(MetabolicRate.MODERATE);
        assertThat(analyzer.getMetabolicProfile(null)).isEqualTo(mixed);
    }

    @Test
    void low_calorie_day_is_called_out_for_ectomorph() {
        LifestyleRecord r = record(List.of(meal(400)), 1800, null);

        BodyTypeInsight i = analyzer.analyze(BodyTypeClassification.ECTOMORPH, r);

        assertThat(i.metabolicResponse()).contains("500 kcal").contains("may be on the low side");
        // 水不足 2500ml → 多一條補水建議
        assertThat(i.recommendations()).extracting(Recommendation::action)
                .anyMatch(a -> a.startsWith("Increase water intake"));
        assertThat(i.observations()).anyMatch(o -> o.contains("below the 2000 ml reference"));
    }

    @Test
    void endomorph_sugar_and_carb_notes_depend_on_the_day() {
        LifestyleRecord sweet = record(List.of(
                FoodItem.of("cake", nutrition(600, 5, 1, 60, 200, 4))), 2000, null);
        LifestyleRecord plain = record(List.of(meal(400)), 2000, null);

        BodyTypeInsight s = analyzer.analyze(BodyTypeClassification.ENDOMORPH, sweet);
        BodyTypeInsight p = analyzer.analyze(BodyTypeClassification.ENDOMORPH, plain);

        assertThat(s.energyUtilization()).contains("sugar intake is high");
        assertThat(s.recommendations()).hasSize(3);
        assertThat(p.energyUtilization()).doesNotContain("sugar intake is high");
        assertThat(p.recommendations()).hasSize(2);
    }

    @Test
    void confidence_is_lower_for_mixed_and_null_means_mixed() {
        LifestyleRecord r = record(List.of(), 2000, null);

        BodyTypeInsight unknown = analyzer.analyze(null, r);

        assertThat(unknown.bodyType()).isEqualTo(BodyTypeClassification.MIXED);
        assertThat(unknown.confidence()).isEqualTo(0.60);
        assertThat(analyzer.analyze(BodyTypeClassification.MESOMORPH, r).confidence()).isEqualTo(0.80);
    }

    @Test
    void missing_record_is_rejected() {
        assertThatThrownBy(() -> analyzer.analyze(BodyTypeClassification.MESOMORPH, null))
                .isInstanceOf(AnalysisValidationException.class);
    }
}
