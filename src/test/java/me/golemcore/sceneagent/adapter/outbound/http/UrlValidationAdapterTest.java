package me.golemcore.sceneagent.adapter.outbound.http;

import me.golemcore.sceneagent.domain.model.UrlValidationResult;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import mockwebserver3.MockResponse;
import mockwebserver3.MockWebServer;
import mockwebserver3.RecordedRequest;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UrlValidationAdapterTest {

    private MockWebServer mockServer;
    private UrlValidationAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        AgentProperties properties = new AgentProperties();
        properties.getModelGeneration().setProbeRetries(2);
        properties.getModelGeneration().setProbeRetryDelay(Duration.ZERO);
        properties.getModelGeneration().setProbeTimeout(Duration.ofSeconds(5));
        adapter = new UrlValidationAdapter(properties, new OkHttpClient(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void shouldAcceptReachableUrlWithHead() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(200)
                .setHeader("Content-Type", "model/gltf-binary"));

        UrlValidationResult result = adapter.validate(mockServer.url("/model.glb").toString());

        assertTrue(result.isValid());
        assertEquals(200, result.getStatusCode());
        assertEquals("model/gltf-binary", result.getContentType());
        RecordedRequest request = mockServer.takeRequest();
        assertEquals("HEAD", request.getMethod());
        assertEquals(UrlValidationAdapter.USER_AGENT, request.getHeader("User-Agent"));
    }

    @Test
    void shouldRetryUntilSuccess() {
        mockServer.enqueue(new MockResponse().setResponseCode(404));
        mockServer.enqueue(new MockResponse().setResponseCode(200));

        UrlValidationResult result = adapter.validate(mockServer.url("/model.glb").toString());

        assertTrue(result.isValid());
        assertEquals(2, mockServer.getRequestCount());
    }

    @Test
    void shouldReportLastErrorAfterRetries() {
        mockServer.enqueue(new MockResponse().setResponseCode(404));
        mockServer.enqueue(new MockResponse().setResponseCode(403));

        UrlValidationResult result = adapter.validate(mockServer.url("/model.glb").toString());

        assertFalse(result.isValid());
        assertEquals(403, result.getStatusCode());
        assertEquals("HTTP error: 403", result.getError());
    }

    @Test
    void shouldRejectEmptyUrlWithoutRequest() {
        UrlValidationResult result = adapter.validate("");

        assertFalse(result.isValid());
        assertEquals("Invalid URL: empty or not a string", result.getError());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void shouldRejectUnsupportedProtocol() {
        UrlValidationResult result = adapter.validate("ftp://cdn.example/model.glb");

        assertFalse(result.isValid());
        assertEquals("Invalid protocol: only http and https are supported", result.getError());
    }

    @Test
    void shouldRejectMalformedUrl() {
        UrlValidationResult result = adapter.validate("not a url");

        assertFalse(result.isValid());
        assertEquals("Invalid URL format", result.getError());
    }
}
