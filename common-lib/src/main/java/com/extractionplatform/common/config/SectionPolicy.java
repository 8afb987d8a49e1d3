package com.extractionplatform.common.config;

/**
 * Per-section expectation used by the confidence rollup.
 *
 * @param expectedMinCount findings needed for a full coverage factor
 * @param weight           share of the overall score; all section weights sum to 1.0
 */
public record SectionPolicy(int expectedMinCount, double weight) {}
