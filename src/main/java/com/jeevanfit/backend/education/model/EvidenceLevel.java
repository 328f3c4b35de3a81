package com.jeevanfit.backend.education.model;

public enum EvidenceLevel {
    WELL_ESTABLISHED,
    SUPPORTED,
    THEORETICAL
}
