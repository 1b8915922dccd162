package com.mimecast.lodestar.http;

import com.mimecast.lodestar.config.DiscoveryConfig;
import com.mimecast.lodestar.exception.ErrorClassifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpWellKnownClientTest {

    private MockWebServer mockServer;
    private OkHttpWellKnownClient client;

    @BeforeEach
    void before() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        Map<String, Object> map = new HashMap<>();
        map.put("connectTimeout", 2);
        map.put("readTimeout", 2);
        map.put("followRedirects", false);
        map.put("userAgent", "lodestar-test");
        client = new OkHttpWellKnownClient(new DiscoveryConfig(map));
    }

    @AfterEach
    void after() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void get() throws IOException, InterruptedException {
        mockServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"m.server\": \"matrix.example.org:443\"}")
                .addHeader("Content-Type", "application/json"));

        HttpResult result = client.get(mockServer.url("/.well-known/matrix/server").toString());

        assertEquals(200, result.getCode());
        assertTrue(result.isSuccessful());
        assertEquals("{\"m.server\": \"matrix.example.org:443\"}", result.getBody());

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("lodestar-test", request.getHeader("User-Agent"));
        assertEquals("application/json", request.getHeader("Accept"));
    }

    @Test
    void statusIsReturned() throws IOException {
        mockServer.enqueue(new MockResponse().setResponseCode(404));

        HttpResult result = client.get(mockServer.url("/.well-known/matrix/client").toString());

        assertEquals(404, result.getCode());
        assertFalse(result.isSuccessful());
        assertEquals("", result.getBody());
    }

    @Test
    void redirectsNotFollowed() throws IOException {
        mockServer.enqueue(new MockResponse()
                .setResponseCode(302)
                .addHeader("Location", mockServer.url("/elsewhere").toString()));

        assertEquals(302, client.get(mockServer.url("/.well-known/matrix/server").toString()).getCode());
        assertEquals(1, mockServer.getRequestCount());
    }

    @Test
    void connectionRefused() throws IOException {
        String url = mockServer.url("/.well-known/matrix/server").toString();
        mockServer.shutdown();

        IOException e = assertThrows(IOException.class, () -> client.get(url));
        assertTrue(ErrorClassifier.isConnectFailure(e));
    }
}
