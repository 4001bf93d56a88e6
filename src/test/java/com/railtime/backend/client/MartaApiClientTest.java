package com.railtime.backend.client;

import com.railtime.backend.exception.UpstreamException;
import com.railtime.backend.exception.UpstreamPermanentException;
import com.railtime.backend.exception.UpstreamTransientException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MartaApiClientTest {

    private static final String API_KEY = "test-api-key";

    private MockWebServer server;
    private MartaApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = newClient(5);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void fetchArrivals_validResponse_returnsRecordsVerbatim() throws Exception {
        server.enqueue(new MockResponse()
                .setBody(Fixtures.ARRIVALS)
                .addHeader("Content-Type", "application/json"));

        List<Map<String, Object>> arrivals = client.fetchArrivals(API_KEY);

        assertEquals(2, arrivals.size());
        assertEquals("FIVE POINTS STATION", arrivals.get(0).get("STATION"));
        assertEquals("RED", arrivals.get(0).get("LINE"));
        assertEquals("303", arrivals.get(1).get("TRAIN_ID"));
        assertEquals("extra", arrivals.get(1).get("UNMODELLED_FIELD"));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("GET", request.getMethod());
        assertEquals("/traindata?apiKey=test-api-key", request.getPath());
        assertEquals("application/json", request.getHeader("Accept"));
    }

    @Test
    void fetchArrivals_apiKeyWithReservedCharacters_isEncoded() throws Exception {
        server.enqueue(new MockResponse()
                .setBody("[]")
                .addHeader("Content-Type", "application/json"));

        List<Map<String, Object>> arrivals = client.fetchArrivals("a+b&c");

        assertTrue(arrivals.isEmpty());
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/traindata?apiKey=a%2Bb%26c", request.getPath());
    }

    @Test
    void fetchArrivals_serviceUnavailable_throwsPermanentWithBody() {
        server.enqueue(new MockResponse()
                .setResponseCode(503)
                .setBody("Service Unavailable"));

        UpstreamException ex = assertThrows(UpstreamException.class, () -> client.fetchArrivals(API_KEY));

        assertInstanceOf(UpstreamPermanentException.class, ex);
        assertFalse(ex.isRetryable());
        assertEquals(503, ex.getStatus());
        assertEquals("Service Unavailable", ex.getDetail());
        assertEquals("MARTA API error (503).", ex.getMessage());
    }

    @Test
    void fetchArrivals_internalServerError_throwsTransient() {
        server.enqueue(new MockResponse()
                .setResponseCode(500)
                .setBody("{\"error\":\"database timeout\"}"));

        UpstreamException ex = assertThrows(UpstreamException.class, () -> client.fetchArrivals(API_KEY));

        assertInstanceOf(UpstreamTransientException.class, ex);
        assertTrue(ex.isRetryable());
        assertEquals(500, ex.getStatus());
        assertEquals("{\"error\":\"database timeout\"}", ex.getDetail());
    }

    @Test
    void fetchArrivals_longErrorBody_isTruncated() {
        server.enqueue(new MockResponse()
                .setResponseCode(401)
                .setBody("x".repeat(800)));

        UpstreamException ex = assertThrows(UpstreamException.class, () -> client.fetchArrivals(API_KEY));

        assertEquals(401, ex.getStatus());
        assertEquals(500, ex.getDetail().length());
    }

    @Test
    void fetchArrivals_emptyErrorBody_reportsNoResponseBody() {
        server.enqueue(new MockResponse().setResponseCode(404));

        UpstreamException ex = assertThrows(UpstreamException.class, () -> client.fetchArrivals(API_KEY));

        assertEquals(404, ex.getStatus());
        assertEquals("No response body.", ex.getDetail());
    }

    @Test
    void fetchArrivals_malformedPayload_throwsPermanent() {
        server.enqueue(new MockResponse()
                .setBody("<html>maintenance</html>")
                .addHeader("Content-Type", "application/json"));

        UpstreamException ex = assertThrows(UpstreamException.class, () -> client.fetchArrivals(API_KEY));

        assertFalse(ex.isRetryable());
        assertEquals(MartaApiClient.MALFORMED_PAYLOAD_STATUS, ex.getStatus());
    }

    @Test
    void fetchArrivals_htmlMaintenancePage_throwsPermanentMalformed() {
        server.enqueue(new MockResponse()
                .setBody("<html>maintenance</html>")
                .addHeader("Content-Type", "text/html"));

        UpstreamException ex = assertThrows(UpstreamException.class, () -> client.fetchArrivals(API_KEY));

        assertInstanceOf(UpstreamPermanentException.class, ex);
        assertFalse(ex.isRetryable());
        assertEquals(MartaApiClient.MALFORMED_PAYLOAD_STATUS, ex.getStatus());
        assertTrue(ex.getDetail().startsWith("Malformed response"));
    }

    @Test
    void fetchArrivals_connectionDropped_throwsTransient() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        UpstreamException ex = assertThrows(UpstreamException.class, () -> client.fetchArrivals(API_KEY));

        assertTrue(ex.isRetryable());
        assertEquals(500, ex.getStatus());
        assertNotNull(ex.getDetail());
    }

    @Test
    void fetchArrivals_slowUpstream_timesOutAsTransient() {
        client = newClient(1);
        server.enqueue(new MockResponse()
                .setBody(Fixtures.ARRIVALS)
                .addHeader("Content-Type", "application/json")
                .setHeadersDelay(3, TimeUnit.SECONDS));

        UpstreamException ex = assertThrows(UpstreamException.class, () -> client.fetchArrivals(API_KEY));

        assertTrue(ex.isRetryable());
        assertEquals(500, ex.getStatus());
    }

    private MartaApiClient newClient(int timeoutSeconds) {
        return new MartaApiClient(WebClient.builder(), new UpstreamRateLimiter(0),
                server.url("/traindata").toString(), timeoutSeconds);
    }

    static class Fixtures {
        static final String ARRIVALS = """
                [
                  {
                    "DESTINATION": "North Springs",
                    "DIRECTION": "N",
                    "EVENT_TIME": "3/1/2024 8:00:12 AM",
                    "LINE": "RED",
                    "NEXT_ARR": "08:02:40 AM",
                    "STATION": "FIVE POINTS STATION",
                    "TRAIN_ID": "402",
                    "WAITING_SECONDS": "148",
                    "WAITING_TIME": "2 min",
                    "IS_REALTIME": "true",
                    "LATITUDE": "33.7539",
                    "LONGITUDE": "-84.3916"
                  },
                  {
                    "DESTINATION": "Airport",
                    "DIRECTION": "S",
                    "EVENT_TIME": "3/1/2024 8:00:12 AM",
                    "LINE": "GOLD",
                    "NEXT_ARR": "08:05:10 AM",
                    "STATION": "ARTS CENTER STATION",
                    "TRAIN_ID": "303",
                    "WAITING_SECONDS": "298",
                    "WAITING_TIME": "4 min",
                    "IS_REALTIME": "false",
                    "LATITUDE": "33.7894",
                    "LONGITUDE": "-84.3872",
                    "UNMODELLED_FIELD": "extra"
                  }
                ]""";
    }
}
