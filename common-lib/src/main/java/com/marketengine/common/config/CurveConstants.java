package com.marketengine.common.config;

/**
 * Power-law constants for one category: {@code units = a * rank^(-b)}.
 */
public record CurveConstants(double a, double b) {}
