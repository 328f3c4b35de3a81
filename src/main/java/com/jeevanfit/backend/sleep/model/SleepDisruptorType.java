package com.jeevanfit.backend.sleep.model;

public enum SleepDisruptorType {
    CAFFEINE,
    LATE_EATING,
    DEHYDRATION,
    OVERHYDRATION,
    STRESS,
    SCREEN_TIME,
    ALCOHOL
}
