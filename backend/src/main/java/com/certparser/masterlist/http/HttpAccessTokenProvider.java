package com.certparser.masterlist.http;

import com.certparser.config.CertParserProperties;
import com.certparser.masterlist.model.HttpExchangeResult;
import com.certparser.masterlist.port.AccessTokenProvider;
import com.certparser.railway.ErrorCode;
import com.certparser.railway.Result;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OAuth2 resource-owner password grant against the upstream identity provider.
 */
@Component
public class HttpAccessTokenProvider implements AccessTokenProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpAccessTokenProvider.class);
    static final String FAILURE_MESSAGE = "Access token acquisition failed";

    private final MasterListHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CertParserProperties.Auth auth;

    public HttpAccessTokenProvider(MasterListHttpClient httpClient, ObjectMapper objectMapper, CertParserProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.auth = properties.getAuth();
    }

    @Override
    public Result<String> acquireToken() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "password");
        form.put("client_id", auth.getClientId());
        form.put("client_secret", auth.getClientSecret());
        form.put("username", auth.getUsername());
        form.put("password", auth.getPassword());

        HttpExchangeResult response = httpClient.postForm(auth.getUrl(), form, Map.of("Accept", "application/json"));
        if (response.isTransportFailure()) {
            return UpstreamResponses.transportFailure(FAILURE_MESSAGE, response);
        }
        if (!response.isSuccessful()) {
            return UpstreamResponses.statusFailure(FAILURE_MESSAGE, response.statusCode(), ErrorCode.AUTHENTICATION_ERROR);
        }
        return Result.<JsonNode>fromComputation(
                () -> objectMapper.readTree(response.bodyBytes()),
                ErrorCode.AUTHENTICATION_ERROR,
                FAILURE_MESSAGE + ": unreadable token response"
            )
            .map(node -> node.path("access_token").asText(""))
            .ensure(token -> !token.isBlank(), ErrorCode.AUTHENTICATION_ERROR, FAILURE_MESSAGE + ": no access_token in response")
            .peek(token -> log.info("Access token acquired after {} attempt(s)", response.attempts()));
    }
}
