package com.certparser.masterlist.model;

import java.util.Map;

public record InfoResponse(
    String name,
    String version,
    boolean schedulerEnabled,
    boolean schedulerStarted,
    boolean schedulerRunning,
    boolean ready,
    boolean hasError,
    boolean dbConnectivity,
    SyncRunSummary lastRun,
    Map<String, Long> counts
) {
}
