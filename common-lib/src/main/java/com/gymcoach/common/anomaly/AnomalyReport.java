package com.gymcoach.common.anomaly;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param evaluatedChannels channels that had enough data points to be tested
 * @param overallSeverity   aggregate in [0, 1]; 0 when nothing was flagged
 */
public record AnomalyReport(
    @JsonProperty("anomalies")         List<AnomalyRecord> anomalies,
    @JsonProperty("evaluatedChannels") List<AnomalyType>   evaluatedChannels,
    @JsonProperty("overallSeverity")   double              overallSeverity,
    @JsonProperty("highCount")         int                 highCount,
    @JsonProperty("mediumCount")       int                 mediumCount
) {
    public boolean anomaliesDetected() {
        return !anomalies.isEmpty();
    }
}
