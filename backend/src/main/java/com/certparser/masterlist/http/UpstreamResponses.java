package com.certparser.masterlist.http;

import com.certparser.masterlist.model.HttpExchangeResult;
import com.certparser.railway.ErrorCode;
import com.certparser.railway.Result;
import com.certparser.railway.ResultFailures;

final class UpstreamResponses {

    private UpstreamResponses() {
    }

    static <T> Result<T> transportFailure(String message, HttpExchangeResult result) {
        if ("invalid_url".equals(result.errorCode())) {
            return Result.failure(ErrorCode.CONFIGURATION_ERROR, message + ": invalid URL " + result.requestedUrl(), result.error());
        }
        return ResultFailures.fromException(message, result.error());
    }

    static <T> Result<T> statusFailure(String message, int statusCode, ErrorCode fallback) {
        ErrorCode code = statusCode == 429 ? ErrorCode.RATE_LIMIT_ERROR : fallback;
        return Result.failure(code, message + ": HTTP " + statusCode);
    }
}
