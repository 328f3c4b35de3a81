package com.jeevanfit.backend.trend.model;

import java.time.LocalDateTime;

public record MetricPoint(LocalDateTime timestamp, double value) {}
