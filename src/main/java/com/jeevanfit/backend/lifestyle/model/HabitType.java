package com.jeevanfit.backend.lifestyle.model;

public enum HabitType {
    EXERCISE,
    STRESS,
    SCREEN_TIME,
    CAFFEINE,
    ALCOHOL,
    OTHER
}
