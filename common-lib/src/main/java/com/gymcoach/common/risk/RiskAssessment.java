package com.gymcoach.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RiskAssessment(
    @JsonProperty("overallScore") double            overallScore,
    @JsonProperty("level")        RiskLevel         level,
    @JsonProperty("variant")      RiskVariant       variant,
    @JsonProperty("factors")      List<FactorScore> factors,
    @JsonProperty("reasons")      List<String>      reasons,
    @JsonProperty("fatigue")      FatigueIndicators fatigue
) {}
