package com.jeevanfit.backend.food;

import com.jeevanfit.backend.common.AnalysisValidationException;
import com.jeevanfit.backend.common.ErrorKind;
import com.jeevanfit.backend.food.model.FoodCategory;
import com.jeevanfit.backend.food.model.FoodClassification;
import com.jeevanfit.backend.food.model.FoodFactor;
import com.jeevanfit.backend.food.model.FsiParameters;
import com.jeevanfit.backend.food.service.FoodClassifier;
import com.jeevanfit.backend.lifestyle.model.FoodItem;
import com.jeevanfit.backend.lifestyle.model.NutritionalInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jeevanfit.backend.testsupport.Fixtures.nutrition;
import static org.assertj.core.api.Assertions.*;

class FoodClassifierTest {

    private final FoodClassifier classifier = new FoodClassifier();

    private static final FoodItem CHIPS = FoodItem.of("potato chips", nutrition(500, 6, 3, 2, 700, 5));
    private static final FoodItem BROCCOLI = FoodItem.of("broccoli", nutrition(34, 2.8, 2.6, 1.7, 33, 1));
    private static final FoodItem CURED_HAM = FoodItem.of("cured ham",
            nutrition(300, 20, 0, 1, 400, 3, "sodium benzoate", "potassium sorbate", "sodium nitrite"));

    @Test
    void same_item_should_give_identical_output() {
        FoodClassification a = classifier.classify(CHIPS);
        FoodClassification b = new FoodClassifier().classify(CHIPS);

        assertThat(a).isEqualTo(b);
        assertThat(a.rationale()).isEqualTo(b.rationale());
    }

    @Test
    void highly_processed_salty_snack_is_junk() {
        FoodClassification c = classifier.classify(CHIPS);

        assertThat(c.category()).isEqualTo(FoodCategory.JUNK);
        assertThat(c.dominantFactors()).containsExactly(FoodFactor.HIGH_PROCESSING, FoodFactor.HIGH_SODIUM);
        assertThat(c.rationale()).contains("processing level 5 >= 4").contains("sodium 700mg > 600mg");
        // 只有 JUNK 成立，分數取 max((5-4)/4, (700-600)/600) = 0.25
        assertThat(c.confidence()).isCloseTo(0.6 + 0.35 * 0.25, within(1e-9));
        assertThat(c.ambiguous()).isFalse();
    }

    @Test
    void whole_vegetable_is_healthy() {
        FoodClassification c = classifier.classify(BROCCOLI);

        assertThat(c.category()).isEqualTo(FoodCategory.HEALTHY);
        assertThat(c.dominantFactors()).containsExactly(
                FoodFactor.NUTRIENT_DENSITY, FoodFactor.LOW_PROCESSING, FoodFactor.FEW_PRESERVATIVES);
        assertThat(c.rationale()).startsWith("Classified as HEALTHY:");
    }

    @Test
    void three_preservatives_make_item_preservative_heavy() {
        FoodClassification c = classifier.classify(CURED_HAM);

        assertThat(c.category()).isEqualTo(FoodCategory.PRESERVATIVE_HEAVY);
        // count (3-3)/3 = 0；load = (1.5 + 1.0 + 1.5) / 5 = 0.8 → (0.8 - 0.6) / 0.6
        assertThat(c.confidence()).isCloseTo(0.6 + 0.35 * ((0.8 - 0.6) / 0.6), within(1e-9));
        assertThat(c.rationale()).contains("3 preservatives >= 3").contains("preservative load 0.80 >= 0.60");
    }

    @Test
    void exact_tie_goes_to_the_more_cautious_category() {
        // JUNK：(800-600)/600 = 1/3；HEALTHY 最弱的一條是 (3-2)/3 = 1/3
        FoodItem saltedNuts = FoodItem.of("salted peanuts",
                nutrition(600, 25, 8, 4, 800, 1, "citric acid", "rosemary extract"));

        FoodClassification c = classifier.classify(saltedNuts);

        assertThat(c.category()).isEqualTo(FoodCategory.JUNK);
        assertThat(c.confidence()).isCloseTo(0.6, within(1e-9));
        assertThat(c.rationale()).contains("Also met: HEALTHY");
    }

    @Test
    void scores_are_the_relative_excess_over_each_threshold() {
        // sodium (700-600)/600 ≈ 0.17；3 個一般防腐劑剛好踩在門檻上 → count 與 load 都是 0
        FoodItem pretzels = FoodItem.of("pretzels",
                nutrition(400, 10, 2, 5, 700, 3, "citric acid", "potassium sorbate", "calcium propionate"));

        FoodClassification c = classifier.classify(pretzels);

        assertThat(c.category()).isEqualTo(FoodCategory.JUNK);
        assertThat(c.dominantFactors()).containsExactly(FoodFactor.HIGH_SODIUM);
        assertThat(c.confidence()).isCloseTo(0.6 + 0.35 * (100.0 / 600.0), within(1e-9));
        assertThat(c.rationale()).contains("Also met: PRESERVATIVE_HEAVY (3 preservatives >= 3");
    }

    @Test
    void fruit_sugar_does_not_count_towards_junk() {
        NutritionalInfo n = nutrition(105, 1.3, 3.1, 17, 1, 1);
        FoodItem banana = new FoodItem("banana", 1.0, "piece", n, null, true);
        FoodItem sweetened = new FoodItem("sweetened puree", 1.0, "cup", n, null, false);

        assertThat(classifier.classify(banana).rationale()).doesNotContain("sugar 17g");
        assertThat(classifier.classify(sweetened).rationale()).contains("Also met: JUNK (sugar 17g > 15g)");
        assertThat(classifier.classify(banana).category()).isEqualTo(FoodCategory.HEALTHY);
    }

    @Test
    void item_crossing_no_threshold_falls_back_cautiously() {
        // density 0.6、processing 3、沒有防腐劑 → 三個候選都不成立
        FoodItem granolaBar = FoodItem.of("granola bar", nutrition(200, 1, 0.2, 10, 300, 3));

        FoodClassification c = classifier.classify(granolaBar);

        assertThat(c.category()).isEqualTo(FoodCategory.JUNK);
        assertThat(c.ambiguous()).isTrue();
        assertThat(c.confidence()).isEqualTo(0.5);
        assertThat(c.dominantFactors()).containsExactly(FoodFactor.OVERALL_COMPOSITION);
        assertThat(c.rationale()).contains("No classification threshold was crossed");
    }

    @Test
    void category_is_always_one_of_the_three_and_confidence_in_range() {
        List<FoodItem> items = List.of(
                CHIPS, BROCCOLI, CURED_HAM,
                FoodItem.of("water", nutrition(0, 0, 0, 0, 0, 1)),
                FoodItem.of("soda", nutrition(140, 0, 0, 39, 45, 4, "sodium benzoate")),
                FoodItem.of("oats", nutrition(150, 5, 4, 1, 2, 2))
        );

        for (FoodItem item : items) {
            FoodClassification c = classifier.classify(item);
            assertThat(c.category()).isIn((Object[]) FoodCategory.values());
            assertThat(c.confidence()).isBetween(0.0, 1.0);
            assertThat(c.rationale()).isNotBlank();
        }
    }

    @Test
    void fsi_parameters_are_normalized() {
        FsiParameters water = classifier.fsiParameters(FoodItem.of("water", nutrition(0, 0, 0, 0, 0, 1)));
        assertThat(water.nutrientDensity()).isEqualTo(0.0);
        assertThat(water.processingScore()).isEqualTo(0.0);

        FsiParameters chips = classifier.fsiParameters(CHIPS);
        assertThat(chips.processingScore()).isEqualTo(1.0);
        assertThat(chips.sodiumLevel()).isCloseTo(0.7, within(1e-9));
        assertThat(chips.nutrientDensity()).isEqualTo(1.0);
    }

    @Test
    void missing_nutrition_is_a_validation_error() {
        FoodItem broken = new FoodItem("mystery", 1.0, "serving", null, null, false);

        AnalysisValidationException ex = catchThrowableOfType(
                () -> classifier.classify(broken), AnalysisValidationException.class);

        assertThat(ex.field()).isEqualTo("nutrition");
        assertThat(ex.kind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(ex.getMessage()).isEqualTo("MISSING_FIELD: nutrition");
    }
}
