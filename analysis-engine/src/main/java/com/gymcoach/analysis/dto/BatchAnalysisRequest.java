package com.gymcoach.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BatchAnalysisRequest(
    @JsonProperty("userIds")    List<String> userIds,
    @JsonProperty("windowDays") Integer      windowDays
) {}
