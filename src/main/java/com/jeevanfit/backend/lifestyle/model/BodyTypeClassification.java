package com.jeevanfit.backend.lifestyle.model;

public enum BodyTypeClassification {
    ECTOMORPH,
    MESOMORPH,
    ENDOMORPH,
    MIXED
}
