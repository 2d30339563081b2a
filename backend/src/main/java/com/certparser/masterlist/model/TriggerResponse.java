package com.certparser.masterlist.model;

import com.certparser.railway.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerResponse(
    String status,
    Integer rowsStored,
    ErrorCode errorCode,
    String message
) {
    public static TriggerResponse success(int rowsStored) {
        return new TriggerResponse("success", rowsStored, null, null);
    }

    public static TriggerResponse failed(ErrorCode errorCode, String message) {
        return new TriggerResponse("failed", null, errorCode, message);
    }
}
