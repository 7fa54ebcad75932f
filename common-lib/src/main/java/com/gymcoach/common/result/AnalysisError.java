package com.gymcoach.common.result;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AnalysisError(
    @JsonProperty("component") String    component,
    @JsonProperty("kind")      ErrorKind kind,
    @JsonProperty("message")   String    message
) {}
