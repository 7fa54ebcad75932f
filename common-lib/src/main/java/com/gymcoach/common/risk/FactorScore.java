package com.gymcoach.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FactorScore(
    @JsonProperty("factor")  RiskFactor   factor,
    @JsonProperty("score")   double       score,
    @JsonProperty("weight")  double       weight,
    @JsonProperty("reasons") List<String> reasons
) {}
