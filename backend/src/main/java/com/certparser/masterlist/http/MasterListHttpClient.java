package com.certparser.masterlist.http;

import com.certparser.config.CertParserProperties;
import com.certparser.masterlist.model.HttpExchangeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Blocking HTTP client for the upstream Master List service. Transport faults (timeouts and IO
 * errors) are retried with exponential backoff; any HTTP response, whatever its status, is
 * returned to the caller as is.
 */
@Service
public class MasterListHttpClient {
    private static final Logger log = LoggerFactory.getLogger(MasterListHttpClient.class);

    private final CertParserProperties.Http settings;
    private final HttpClient client;

    public MasterListHttpClient(
        CertParserProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.settings = properties.getHttp();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpExchangeResult get(String url, Map<String, String> headers) {
        return send(url, "GET", headers, null, null);
    }

    public HttpExchangeResult postJson(String url, String jsonBody, Map<String, String> headers) {
        return send(url, "POST", headers, jsonBody == null ? "" : jsonBody, "application/json");
    }

    public HttpExchangeResult postForm(String url, Map<String, String> form, Map<String, String> headers) {
        return send(url, "POST", headers, encodeForm(form), "application/x-www-form-urlencoded");
    }

    static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
            .map(entry -> URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "="
                + URLEncoder.encode(entry.getValue() == null ? "" : entry.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    private HttpExchangeResult send(String url, String method, Map<String, String> headers, String body, String contentType) {
        int maxAttempts = settings.getMaxAttempts();
        HttpExchangeResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, method, headers, body, contentType, attempt);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.warn(
                "{} {} failed with {} on attempt {}/{}, retrying",
                method,
                url,
                lastResult.errorCode(),
                attempt,
                maxAttempts
            );
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpExchangeResult executeOnce(
        String url,
        String method,
        Map<String, String> headers,
        String body,
        String contentType,
        int attempt
    ) {
        Instant startedAt = Instant.now();
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()));
            if (headers != null) {
                headers.forEach(builder::header);
            }
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", contentType)
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            return new HttpExchangeResult(
                url,
                response.statusCode(),
                response.body(),
                attempt,
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, attempt, "timeout", e);
        } catch (IOException e) {
            return errorResult(url, startedAt, attempt, "io_error", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, attempt, "interrupted", e);
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, attempt, "invalid_url", e);
        }
    }

    private boolean shouldRetry(HttpExchangeResult result) {
        String errorCode = result.errorCode();
        return "timeout".equals(errorCode) || "io_error".equals(errorCode);
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = settings.getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = settings.getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpExchangeResult errorResult(String url, Instant startedAt, int attempt, String code, Exception error) {
        return new HttpExchangeResult(
            url,
            0,
            null,
            attempt,
            Duration.between(startedAt, Instant.now()),
            code,
            error
        );
    }
}
