package com.example.music2db;

import com.example.music2db.metadata.TrackMetadata;
import com.example.music2db.metadata.TrackRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpCatalogClientTest {
    private FakeCatalogServer server;
    private HttpCatalogClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeCatalogServer();
        client = new HttpCatalogClient(server.baseUri(), "/add_track/", "/add_tracks/");
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
    }

    @Test
    void healthyServerPassesHealthCheck() {
        Outcome<String> health = client.checkHealth();

        assertTrue(health.isSuccess());
        assertEquals(List.of("GET /health/"), server.requests);
    }

    @Test
    void non200HealthIsAFailure() {
        server.healthStatus = 503;

        Outcome<String> health = client.checkHealth();

        assertFalse(health.isSuccess());
        assertEquals(FailureKind.HTTP_STATUS, health.getFailure().kind());
    }

    @Test
    void unexpectedHealthBodyIsAFailure() {
        server.healthBody = "{\"status\": \"starting\"}";

        Outcome<String> health = client.checkHealth();

        assertEquals(FailureKind.UNEXPECTED_RESPONSE, health.getFailure().kind());
    }

    @Test
    void nonJsonHealthBodyIsAFailure() {
        server.healthBody = "<html>proxy error</html>";

        assertEquals(FailureKind.UNEXPECTED_RESPONSE, client.checkHealth().getFailure().kind());
    }

    @Test
    void unreachableServerIsANetworkFailure() {
        int port = server.port();
        server.close();
        HttpCatalogClient offline = new HttpCatalogClient(URI.create("http://127.0.0.1:" + port), "/add_track/", "/add_tracks/");

        Outcome<String> health = offline.checkHealth();
        Outcome<String> batch = offline.sendTracks(List.of(track("a.mp3")));
        offline.close();

        assertEquals(FailureKind.NETWORK_ERROR, health.getFailure().kind());
        assertEquals(FailureKind.NETWORK_ERROR, batch.getFailure().kind());
    }

    @Test
    void malformedEndpointIsAFailureNotAnException() {
        HttpCatalogClient broken = new HttpCatalogClient(server.baseUri(), "/add track/", "/add tracks/");

        Outcome<String> batch = broken.sendTracks(List.of(track("a.mp3")));
        Outcome<Void> single = broken.sendTrack(track("b.mp3"));
        broken.close();

        assertEquals(FailureKind.NETWORK_ERROR, batch.getFailure().kind());
        assertEquals(FailureKind.NETWORK_ERROR, single.getFailure().kind());
        assertTrue(server.requests.isEmpty());
    }

    @Test
    void batchIsPostedAsJsonArrayOfRecords() throws Exception {
        TrackRecord first = new TrackRecord("artist/a.mp3", TrackMetadata.builder().length(215).title("A").build());
        TrackRecord second = new TrackRecord("b.flac", TrackMetadata.builder().artist("B").year("1999").build());

        Outcome<String> outcome = client.sendTracks(List.of(first, second));

        assertTrue(outcome.isSuccess());
        assertEquals("Tracks added", outcome.getValue());
        assertEquals(List.of("POST /add_tracks/"), server.requests);
        JsonNode body = new ObjectMapper().readTree(server.bodies.get(0));
        assertTrue(body.isArray());
        assertEquals(2, body.size());
        assertEquals("artist/a.mp3", body.get(0).get("file_path").asText());
        assertEquals(215, body.get(0).get("metadata").get("length").asInt());
        assertFalse(body.get(0).get("metadata").has("artist"));
        assertEquals("1999", body.get(1).get("metadata").get("year").asText());
    }

    @Test
    void rejectedBatchIsAFailure() {
        server.postStatus = 500;
        server.postBody = "{\"detail\": \"boom\"}";

        Outcome<String> outcome = client.sendTracks(List.of(track("a.mp3")));

        assertEquals(FailureKind.HTTP_STATUS, outcome.getFailure().kind());
    }

    @Test
    void batchResponseWithoutMessageIsAFailure() {
        server.postBody = "{}";

        assertEquals(FailureKind.UNEXPECTED_RESPONSE, client.sendTracks(List.of(track("a.mp3"))).getFailure().kind());
    }

    @Test
    void singleTrackIsPostedToOneTrackEndpoint() throws Exception {
        Outcome<Void> outcome = client.sendTrack(track("solo.mp3"));

        assertTrue(outcome.isSuccess());
        assertEquals(List.of("POST /add_track/"), server.requests);
        JsonNode body = new ObjectMapper().readTree(server.bodies.get(0));
        assertEquals("solo.mp3", body.get("file_path").asText());
        assertEquals("solo.mp3", body.get("metadata").get("title").asText());
    }

    @Test
    void rejectedSingleTrackIsAFailure() {
        server.postStatus = 422;

        assertEquals(FailureKind.HTTP_STATUS, client.sendTrack(track("solo.mp3")).getFailure().kind());
    }

    private static TrackRecord track(String path) {
        return new TrackRecord(path, TrackMetadata.builder().title(path).build());
    }
}
