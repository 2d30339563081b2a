package com.certparser.masterlist.http;

import com.certparser.config.CertParserProperties;
import com.certparser.masterlist.model.AuthCredentials;
import com.certparser.masterlist.model.HttpExchangeResult;
import com.certparser.masterlist.port.BinaryDownloader;
import com.certparser.railway.ErrorCode;
import com.certparser.railway.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class HttpBinaryDownloader implements BinaryDownloader {
    private static final Logger log = LoggerFactory.getLogger(HttpBinaryDownloader.class);
    static final String FAILURE_MESSAGE = "Binary download failed";
    static final String SFC_HEADER = "x-sfc-authorization";

    private final MasterListHttpClient httpClient;
    private final String downloadUrl;

    public HttpBinaryDownloader(MasterListHttpClient httpClient, CertParserProperties properties) {
        this.httpClient = httpClient;
        this.downloadUrl = properties.getDownload().getUrl();
    }

    @Override
    public Result<byte[]> download(AuthCredentials credentials) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + credentials.accessToken());
        headers.put(SFC_HEADER, "Bearer " + credentials.sfcToken());
        headers.put("Accept", "application/octet-stream");

        HttpExchangeResult response = httpClient.get(downloadUrl, headers);
        if (response.isTransportFailure()) {
            return UpstreamResponses.transportFailure(FAILURE_MESSAGE, response);
        }
        int status = response.statusCode();
        if (status == 401 || status == 403) {
            return UpstreamResponses.statusFailure(FAILURE_MESSAGE, status, ErrorCode.AUTHENTICATION_ERROR);
        }
        if (status == 404) {
            return UpstreamResponses.statusFailure(FAILURE_MESSAGE, status, ErrorCode.NOT_FOUND);
        }
        if (!response.isSuccessful()) {
            return UpstreamResponses.statusFailure(FAILURE_MESSAGE, status, ErrorCode.EXTERNAL_SERVICE_ERROR);
        }
        return Result.fromNullable(response.bodyBytes(), ErrorCode.EXTERNAL_SERVICE_ERROR, FAILURE_MESSAGE + ": no body")
            .ensure(bytes -> bytes.length > 0, ErrorCode.EXTERNAL_SERVICE_ERROR, FAILURE_MESSAGE + ": empty body")
            .peek(bytes -> log.info("Downloaded master list bytes={} attempts={}", bytes.length, response.attempts()));
    }
}
