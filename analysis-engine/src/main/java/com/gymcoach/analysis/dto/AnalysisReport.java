package com.gymcoach.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gymcoach.common.adaptation.AdaptationStrategy;
import com.gymcoach.common.anomaly.AnomalyReport;
import com.gymcoach.common.plateau.PlateauReport;
import com.gymcoach.common.result.ErrorKind;
import com.gymcoach.common.result.Result;
import com.gymcoach.common.risk.RiskAssessment;
import com.gymcoach.common.trend.TrendReport;

/**
 * Full analysis of one user. Each component carries its own status, so a failed risk
 * assessment does not hide a valid trend report.
 */
public record AnalysisReport(
    @JsonProperty("userId")     String                     userId,
    @JsonProperty("traceId")    String                     traceId,
    @JsonProperty("trends")     Result<TrendReport>        trends,
    @JsonProperty("anomalies")  Result<AnomalyReport>      anomalies,
    @JsonProperty("plateaus")   Result<PlateauReport>      plateaus,
    @JsonProperty("risk")       Result<RiskAssessment>     risk,
    @JsonProperty("adaptation") Result<AdaptationStrategy> adaptation
) {
    /** Every component failed with the same error, e.g. when the user's profile could not be fetched. */
    public static AnalysisReport failed(String userId, String traceId, ErrorKind kind, String message) {
        return new AnalysisReport(userId, traceId,
            Result.failed("TrendAnalyzer", kind, message),
            Result.failed("AnomalyDetector", kind, message),
            Result.failed("PlateauDetector", kind, message),
            Result.failed("RiskAssessor", kind, message),
            Result.failed("AdaptationSelector", kind, message));
    }
}
