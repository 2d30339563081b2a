package com.certparser.masterlist.http;

import com.certparser.config.CertParserProperties;
import com.certparser.masterlist.model.HttpExchangeResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class MasterListHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void transportFaultsAreRetriedUntilSuccess() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        server.enqueue(new MockResponse().setBody("ok"));
        server.start();

        HttpExchangeResult result = client(3).get(server.url("/masterlist").toString(), Map.of());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.bodyText()).isEqualTo("ok");
        assertThat(result.attempts()).isGreaterThan(1);
    }

    @Test
    void retriesStopAtMaxAttempts() throws Exception {
        server = new MockWebServer();
        server.start();
        String url = server.url("/masterlist").toString();
        server.shutdown();
        server = null;

        HttpExchangeResult result = client(2).get(url, Map.of());

        assertThat(result.isTransportFailure()).isTrue();
        assertThat(result.errorCode()).isEqualTo("io_error");
        assertThat(result.attempts()).isEqualTo(2);
    }

    @Test
    void serverErrorsAreReturnedWithoutRetry() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setBody("unused"));
        server.start();

        HttpExchangeResult result = client(3).get(server.url("/masterlist").toString(), Map.of());

        assertThat(result.statusCode()).isEqualTo(503);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void formValuesAreUrlEncoded() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("username", "a b");
        form.put("password", "x&y=z");
        form.put("empty", null);
        assertThat(MasterListHttpClient.encodeForm(form)).isEqualTo("username=a+b&password=x%26y%3Dz&empty=");
    }

    private MasterListHttpClient client(int maxAttempts) {
        CertParserProperties properties = new CertParserProperties();
        properties.getHttp().setTimeoutSeconds(5);
        properties.getHttp().setMaxAttempts(maxAttempts);
        properties.getHttp().setRetryBaseDelayMs(1);
        properties.getHttp().setRetryMaxDelayMs(5);
        executor = Executors.newFixedThreadPool(1);
        return new MasterListHttpClient(properties, executor);
    }
}
