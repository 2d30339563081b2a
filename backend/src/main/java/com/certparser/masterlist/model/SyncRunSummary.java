package com.certparser.masterlist.model;

import com.certparser.railway.ErrorCode;

import java.time.Instant;

public record SyncRunSummary(
    String trigger,
    Instant startedAt,
    Instant finishedAt,
    boolean success,
    Integer rowsStored,
    ErrorCode errorCode,
    String message
) {
}
