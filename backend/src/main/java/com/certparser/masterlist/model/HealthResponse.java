package com.certparser.masterlist.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
    String status,
    Boolean schedulerRunning,
    String error,
    String reason
) {
}
