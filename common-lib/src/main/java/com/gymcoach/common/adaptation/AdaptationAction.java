package com.gymcoach.common.adaptation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AdaptationAction {
    @JsonProperty("maintain")             MAINTAIN,
    @JsonProperty("progressive_overload") PROGRESSIVE_OVERLOAD,
    @JsonProperty("break_plateau")        BREAK_PLATEAU,
    @JsonProperty("reduce_load")          REDUCE_LOAD,
    @JsonProperty("recovery_focus")       RECOVERY_FOCUS,
    @JsonProperty("simplify")             SIMPLIFY
}
