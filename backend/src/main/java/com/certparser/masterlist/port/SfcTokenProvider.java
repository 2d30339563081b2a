package com.certparser.masterlist.port;

import com.certparser.railway.Result;

public interface SfcTokenProvider {

    /**
     * Exchanges an access token for the service-specific (SFC) token required by the download.
     */
    Result<String> acquireToken(String accessToken);
}
