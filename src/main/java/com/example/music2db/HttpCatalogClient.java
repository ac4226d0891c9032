package com.example.music2db;

import com.example.music2db.metadata.TrackRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

public final class HttpCatalogClient implements CatalogClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpCatalogClient.class);

    static final String HEALTH_PATH = "/health/";
    static final String HEALTHY_STATUS = "Server is running";
    static final int HEALTH_TIMEOUT_MILLIS = 5_000;

    private final ObjectMapper mapper = new ObjectMapper();
    private final CloseableHttpClient httpClient;
    private final String baseUrl;
    private final String oneTrackEndpoint;
    private final String manyTracksEndpoint;
    private final RequestConfig healthRequestConfig;

    public HttpCatalogClient(ClientConfig config) {
        this(config.catalogBase(), config.oneTrackEndpoint(), config.manyTracksEndpoint());
    }

    public HttpCatalogClient(URI baseUri, String oneTrackEndpoint, String manyTracksEndpoint) {
        this.baseUrl = baseUri.toString().replaceAll("/+$", "");
        this.oneTrackEndpoint = oneTrackEndpoint;
        this.manyTracksEndpoint = manyTracksEndpoint;
        this.httpClient = HttpClients.custom()
                .useSystemProperties()
                .build();
        this.healthRequestConfig = RequestConfig.custom()
                .setConnectTimeout(HEALTH_TIMEOUT_MILLIS)
                .setConnectionRequestTimeout(HEALTH_TIMEOUT_MILLIS)
                .setSocketTimeout(HEALTH_TIMEOUT_MILLIS)
                .build();
    }

    @Override
    public Outcome<String> checkHealth() {
        try {
            HttpGet request = new HttpGet(baseUrl + HEALTH_PATH);
            request.setConfig(healthRequestConfig);
            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int status = response.getStatusLine().getStatusCode();
                String body = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
                if (status != HttpStatus.SC_OK) {
                    return Outcome.failure(FailureKind.HTTP_STATUS, "health check returned status " + status);
                }
                String reported = textField(body, "status");
                if (!HEALTHY_STATUS.equals(reported)) {
                    return Outcome.failure(FailureKind.UNEXPECTED_RESPONSE, "invalid health response: " + abbreviate(body));
                }
                return Outcome.success(reported);
            }
        } catch (IOException | RuntimeException ex) {
            // a malformed base URL fails in the request constructor, not in execute
            return Outcome.failure(FailureKind.NETWORK_ERROR, "health check failed: " + ex);
        }
    }

    @Override
    public Outcome<Void> sendTrack(TrackRecord track) {
        String url = baseUrl + oneTrackEndpoint;
        LOGGER.debug("Sending metadata for {} to {}", track.filePath(), url);
        return post(url, track).map(body -> null);
    }

    @Override
    public Outcome<String> sendTracks(List<TrackRecord> tracks) {
        String url = baseUrl + manyTracksEndpoint;
        LOGGER.debug("Sending batch of {} tracks to {}", tracks.size(), url);
        Outcome<String> posted = post(url, tracks);
        if (!posted.isSuccess()) {
            return posted;
        }
        String message = textField(posted.getValue(), "message");
        if (message == null) {
            return Outcome.failure(FailureKind.UNEXPECTED_RESPONSE, "batch response without message: " + abbreviate(posted.getValue()));
        }
        return Outcome.success(message);
    }

    private Outcome<String> post(String url, Object payload) {
        try {
            HttpPost request = new HttpPost(url);
            request.setEntity(new StringEntity(mapper.writeValueAsString(payload), ContentType.APPLICATION_JSON));
            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int status = response.getStatusLine().getStatusCode();
                String body = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
                if (status != HttpStatus.SC_OK) {
                    return Outcome.failure(FailureKind.HTTP_STATUS, "status " + status + " from " + url);
                }
                return Outcome.success(body);
            }
        } catch (IOException | RuntimeException ex) {
            return Outcome.failure(FailureKind.NETWORK_ERROR, ex.toString());
        }
    }

    private String textField(String body, String field) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(body).get(field);
            return node == null || node.isNull() ? null : node.asText();
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private String abbreviate(String body) {
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }

    @Override
    public void close() {
        try {
            httpClient.close();
        } catch (IOException ex) {
            LOGGER.warn("Failed to close HTTP client", ex);
        }
    }
}
