package com.certparser.masterlist.port;

import com.certparser.railway.Result;

public interface AccessTokenProvider {

    Result<String> acquireToken();
}
