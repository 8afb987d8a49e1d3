package com.extractionplatform.common.confidence;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One multiplicative adjustment to the overall score, reported individually so the
 * final number can be audited.
 */
public record Penalty(
    @JsonProperty("code")   String code,
    @JsonProperty("reason") String reason,
    @JsonProperty("factor") double factor
) {

    public static final String WEAK_SECTION           = "WEAK_SECTION";
    public static final String UNRESOLVED_UNCERTAINTY = "UNRESOLVED_UNCERTAINTY";
    public static final String UNRESOLVED_CONFLICT    = "UNRESOLVED_CONFLICT";
}
