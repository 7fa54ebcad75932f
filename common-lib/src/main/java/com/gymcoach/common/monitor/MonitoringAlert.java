package com.gymcoach.common.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MonitoringAlert(
    @JsonProperty("type")    AlertType  type,
    @JsonProperty("level")   AlertLevel level,
    @JsonProperty("message") String     message
) {}
