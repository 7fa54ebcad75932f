package com.gymcoach.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The two scoring schemes. They share the [0, 1] scale but not their cut-points, so a
 * level is only meaningful together with the variant that produced it.
 */
public enum RiskVariant {
    /** Eight weighted factors; used before adapting a plan. */
    @JsonProperty("injury")     INJURY,
    /** Additive flags; used by routine progress monitoring. */
    @JsonProperty("monitoring") MONITORING
}
