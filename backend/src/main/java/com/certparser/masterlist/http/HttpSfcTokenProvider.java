package com.certparser.masterlist.http;

import com.certparser.config.CertParserProperties;
import com.certparser.masterlist.model.HttpExchangeResult;
import com.certparser.masterlist.port.SfcTokenProvider;
import com.certparser.railway.ErrorCode;
import com.certparser.railway.Result;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class HttpSfcTokenProvider implements SfcTokenProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpSfcTokenProvider.class);
    static final String FAILURE_MESSAGE = "SFC token acquisition failed";

    private final MasterListHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CertParserProperties.Login login;

    public HttpSfcTokenProvider(MasterListHttpClient httpClient, ObjectMapper objectMapper, CertParserProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.login = properties.getLogin();
    }

    @Override
    public Result<String> acquireToken(String accessToken) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("borderPostId", login.getBorderPostId());
        body.put("boxId", login.getBoxId());
        body.put("passengerControlType", login.getPassengerControlType());

        return Result.fromComputation(
                () -> objectMapper.writeValueAsString(body),
                ErrorCode.TECHNICAL_ERROR,
                FAILURE_MESSAGE + ": could not encode login request"
            )
            .flatMap(json -> exchange(json, accessToken));
    }

    private Result<String> exchange(String json, String accessToken) {
        HttpExchangeResult response = httpClient.postJson(
            login.getUrl(),
            json,
            Map.of("Authorization", "Bearer " + accessToken)
        );
        if (response.isTransportFailure()) {
            return UpstreamResponses.transportFailure(FAILURE_MESSAGE, response);
        }
        if (!response.isSuccessful()) {
            return UpstreamResponses.statusFailure(FAILURE_MESSAGE, response.statusCode(), ErrorCode.AUTHENTICATION_ERROR);
        }
        return Result.success(response.bodyText().trim())
            .ensure(token -> !token.isEmpty(), ErrorCode.AUTHENTICATION_ERROR, FAILURE_MESSAGE + ": empty token")
            .peek(token -> log.info("SFC token acquired after {} attempt(s)", response.attempts()));
    }
}
