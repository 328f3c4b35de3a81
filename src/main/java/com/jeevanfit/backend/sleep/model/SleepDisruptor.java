package com.jeevanfit.backend.sleep.model;

public record SleepDisruptor(
        SleepDisruptorType type,
        int severity,
        String timing,
        String recommendation
) {}
