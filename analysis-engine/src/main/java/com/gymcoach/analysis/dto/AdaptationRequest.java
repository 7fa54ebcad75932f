package com.gymcoach.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gymcoach.common.model.UserProfile;
import com.gymcoach.common.plateau.PlateauReport;
import com.gymcoach.common.risk.RiskAssessment;
import com.gymcoach.common.trend.TrendReport;

/**
 * Previously computed reports handed straight to the selector. Any of the three may be
 * omitted; the selector then treats that input as insufficient.
 */
public record AdaptationRequest(
    @JsonProperty("trends")   TrendReport    trends,
    @JsonProperty("plateaus") PlateauReport  plateaus,
    @JsonProperty("risk")     RiskAssessment risk,
    @JsonProperty("profile")  UserProfile    profile
) {}
