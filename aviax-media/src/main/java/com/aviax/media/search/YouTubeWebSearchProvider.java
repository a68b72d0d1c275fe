package com.aviax.media.search;

import com.aviax.common.config.AviaxConfig;
import com.aviax.media.MediaException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Search provider backed by the platform's public web search endpoint.
 * Reads {@code videoRenderer} nodes from the response in document order.
 */
@Slf4j
public class YouTubeWebSearchProvider implements SearchProvider {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final AviaxConfig.SearchConfig config;

    public YouTubeWebSearchProvider(AviaxConfig.SearchConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public YouTubeWebSearchProvider(AviaxConfig.SearchConfig config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public List<SearchResult> search(String text, int limit) throws MediaException, InterruptedException {
        if (text == null || text.isBlank() || limit < 1) {
            return List.of();
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.getEndpoint()))
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(text)))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new MediaException.TransientExtractionException("search request failed: " + e.getMessage(), e);
        }
        if (response.statusCode() != 200) {
            throw new MediaException.TransientExtractionException(
                    "search returned HTTP " + response.statusCode());
        }
        return parseResults(response.body(), limit);
    }

    String requestBody(String text) {
        ObjectNode body = mapper.createObjectNode();
        ObjectNode client = body.putObject("context").putObject("client");
        client.put("clientName", "WEB");
        client.put("clientVersion", config.getClientVersion());
        client.put("hl", config.getLanguage());
        client.put("gl", config.getRegion());
        body.put("query", text.trim());
        return body.toString();
    }

    List<SearchResult> parseResults(String json, int limit) throws MediaException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MediaException.TransientExtractionException(
                    "unparseable search response: " + e.getOriginalMessage(), e);
        }
        List<SearchResult> results = new ArrayList<>();
        if (root == null) {
            return results;
        }
        for (JsonNode renderer : root.findValues("videoRenderer")) {
            String id = renderer.path("videoId").asText("");
            if (id.isEmpty()) {
                continue;
            }
            List<String> thumbnails = new ArrayList<>();
            for (JsonNode thumb : renderer.path("thumbnail").path("thumbnails")) {
                String url = thumb.path("url").asText("");
                if (!url.isEmpty()) {
                    thumbnails.add(url);
                }
            }
            results.add(new SearchResult(id, title(renderer), renderer.path("lengthText").path("simpleText").asText(""),
                    thumbnails));
            if (results.size() >= limit) {
                break;
            }
        }
        log.debug("Search yielded {} result(s)", results.size());
        return results;
    }

    private static String title(JsonNode renderer) {
        JsonNode title = renderer.path("title");
        JsonNode runs = title.path("runs");
        if (runs.isArray() && runs.size() > 0) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode run : runs) {
                sb.append(run.path("text").asText(""));
            }
            return sb.toString();
        }
        return title.path("simpleText").asText("");
    }
}
