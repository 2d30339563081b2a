package com.certparser.masterlist.http;

import com.certparser.config.CertParserProperties;
import com.certparser.masterlist.model.AuthCredentials;
import com.certparser.railway.ErrorCode;
import com.certparser.railway.FailureDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.certparser.railway.ResultAssertions.assertFailure;
import static com.certparser.railway.ResultAssertions.assertSuccess;
import static org.assertj.core.api.Assertions.assertThat;

class MasterListHttpAdaptersTest {
    private MockWebServer server;
    private ExecutorService executor;
    private CertParserProperties properties;
    private MasterListHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);

        properties = new CertParserProperties();
        properties.getAuth().setUrl(server.url("/token").toString());
        properties.getAuth().setClientId("border-client");
        properties.getAuth().setClientSecret("s3cret");
        properties.getAuth().setUsername("officer");
        properties.getAuth().setPassword("p@ss word");
        properties.getLogin().setUrl(server.url("/login").toString());
        properties.getLogin().setBorderPostId("12");
        properties.getLogin().setBoxId("XX/99");
        properties.getLogin().setPassengerControlType("1");
        properties.getDownload().setUrl(server.url("/masterlist").toString());
        properties.getHttp().setTimeoutSeconds(5);
        properties.getHttp().setMaxAttempts(3);
        properties.getHttp().setRetryBaseDelayMs(1);
        properties.getHttp().setRetryMaxDelayMs(5);
        httpClient = new MasterListHttpClient(properties, executor);
    }

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
    void accessTokenUsesPasswordGrant() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"access_token\":\"abc123\",\"expires_in\":300}"));
        HttpAccessTokenProvider provider = new HttpAccessTokenProvider(httpClient, objectMapper, properties);

        assertThat(assertSuccess(provider.acquireToken())).isEqualTo("abc123");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Content-Type")).startsWith("application/x-www-form-urlencoded");
        assertThat(request.getBody().readUtf8()).isEqualTo(
            "grant_type=password&client_id=border-client&client_secret=s3cret&username=officer&password=p%40ss+word"
        );
    }

    @Test
    void rejectedCredentialsAreNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"invalid_grant\"}"));
        HttpAccessTokenProvider provider = new HttpAccessTokenProvider(httpClient, objectMapper, properties);

        assertThat(assertFailure(provider.acquireToken(), ErrorCode.AUTHENTICATION_ERROR).message())
            .isEqualTo("Access token acquisition failed: HTTP 401");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void responseWithoutAccessTokenFails() {
        server.enqueue(new MockResponse().setBody("{\"token_type\":\"bearer\"}"));
        HttpAccessTokenProvider provider = new HttpAccessTokenProvider(httpClient, objectMapper, properties);

        assertFailure(provider.acquireToken(), ErrorCode.AUTHENTICATION_ERROR);
    }

    @Test
    void rateLimitedTokenRequestIsClassifiedAsRateLimit() {
        server.enqueue(new MockResponse().setResponseCode(429));
        HttpAccessTokenProvider provider = new HttpAccessTokenProvider(httpClient, objectMapper, properties);

        assertFailure(provider.acquireToken(), ErrorCode.RATE_LIMIT_ERROR);
    }

    @Test
    void sfcTokenSendsBearerAndLoginBody() throws Exception {
        server.enqueue(new MockResponse().setBody("sfc-token-value\n"));
        HttpSfcTokenProvider provider = new HttpSfcTokenProvider(httpClient, objectMapper, properties);

        assertThat(assertSuccess(provider.acquireToken("abc123"))).isEqualTo("sfc-token-value");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer abc123");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(objectMapper.readTree(request.getBody().readUtf8()))
            .isEqualTo(objectMapper.readTree("{\"borderPostId\":\"12\",\"boxId\":\"XX/99\",\"passengerControlType\":\"1\"}"));
    }

    @Test
    void emptySfcTokenFails() {
        server.enqueue(new MockResponse().setBody("   "));
        HttpSfcTokenProvider provider = new HttpSfcTokenProvider(httpClient, objectMapper, properties);

        assertFailure(provider.acquireToken("abc123"), ErrorCode.AUTHENTICATION_ERROR);
    }

    @Test
    void downloadSendsBothTokens() throws Exception {
        byte[] binary = {0x30, (byte) 0x80, 0x06, 0x09, 0x00, (byte) 0xff};
        server.enqueue(new MockResponse().setBody(new Buffer().write(binary)));
        HttpBinaryDownloader downloader = new HttpBinaryDownloader(httpClient, properties);

        assertThat(assertSuccess(downloader.download(new AuthCredentials("abc123", "sfc456")))).isEqualTo(binary);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer abc123");
        assertThat(request.getHeader("x-sfc-authorization")).isEqualTo("Bearer sfc456");
    }

    @Test
    void downloadStatusFailuresAreClassified() {
        server.enqueue(new MockResponse().setResponseCode(403));
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(502));
        server.enqueue(new MockResponse().setResponseCode(200));
        HttpBinaryDownloader downloader = new HttpBinaryDownloader(httpClient, properties);
        AuthCredentials credentials = new AuthCredentials("a", "s");

        assertFailure(downloader.download(credentials), ErrorCode.AUTHENTICATION_ERROR);
        assertFailure(downloader.download(credentials), ErrorCode.NOT_FOUND);
        assertFailure(downloader.download(credentials), ErrorCode.EXTERNAL_SERVICE_ERROR);
        assertThat(assertFailure(downloader.download(credentials), ErrorCode.EXTERNAL_SERVICE_ERROR).message())
            .isEqualTo("Binary download failed: empty body");
        assertThat(server.getRequestCount()).isEqualTo(4);
    }

    @Test
    void unreachableUpstreamIsRetriedThenReportedAsExternalServiceError() throws Exception {
        String deadUrl = server.url("/token").toString();
        server.shutdown();
        server = null;
        properties.getAuth().setUrl(deadUrl);
        HttpAccessTokenProvider provider = new HttpAccessTokenProvider(httpClient, objectMapper, properties);

        assertThat(assertFailure(provider.acquireToken(), ErrorCode.EXTERNAL_SERVICE_ERROR).message())
            .isEqualTo("Access token acquisition failed");
    }

    @Test
    void droppedDownloadConnectionReportsFixedMessage() {
        for (int i = 0; i < 4; i++) {
            server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        }
        properties.getHttp().setMaxAttempts(1);
        HttpBinaryDownloader downloader = new HttpBinaryDownloader(new MasterListHttpClient(properties, executor), properties);

        FailureDescription error = downloader.download(new AuthCredentials("a", "s")).unwrapFailure();

        assertThat(error.message()).isEqualTo("Binary download failed");
        assertThat(error.hasCause()).isTrue();
    }

    @Test
    void malformedUrlIsAConfigurationError() {
        properties.getDownload().setUrl("not a url");
        HttpBinaryDownloader downloader = new HttpBinaryDownloader(httpClient, properties);

        assertFailure(downloader.download(new AuthCredentials("a", "s")), ErrorCode.CONFIGURATION_ERROR);
    }
}
