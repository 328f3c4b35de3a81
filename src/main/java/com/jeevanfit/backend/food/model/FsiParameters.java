package com.jeevanfit.backend.food.model;

/**
 * FSI/ISO 風格的營養參數，全部落在 0..1。
 * processingScore / preservativeLoad / sugarContent / sodiumLevel 越高越差；nutrientDensity 越高越好。
 */
public record FsiParameters(
        double nutrientDensity,
        double processingScore,
        double preservativeLoad,
        double sugarContent,
        double sodiumLevel
) {}
