package com.certparser.masterlist.port;

import com.certparser.masterlist.model.AuthCredentials;
import com.certparser.railway.Result;

public interface BinaryDownloader {

    Result<byte[]> download(AuthCredentials credentials);
}
