package com.jeevanfit.backend.bodytype.model;

import com.jeevanfit.backend.common.Recommendation;
import com.jeevanfit.backend.lifestyle.model.BodyTypeClassification;

import java.util.List;

public record BodyTypeInsight(
        BodyTypeClassification bodyType,
        MetabolicProfile profile,
        String metabolicResponse,
        String fatStoragePattern,
        String energyUtilization,
        NutritionalNeeds nutritionalNeeds,
        List<Recommendation> recommendations,
        List<String> observations,
        double confidence
) {
    public BodyTypeInsight {
        recommendations = List.copyOf(recommendations);
        observations = List.copyOf(observations);
    }
}
