package com.ashby.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Minimal JSON client for the REST API of a running {@code ashby serve}.
 */
class ServerClient {

    /** Status code plus parsed body (a missing node for empty bodies). */
    record Response(int status, JsonNode body) {}

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    ServerClient(String host, int port, ObjectMapper objectMapper) {
        this.baseUrl = "http://" + host + ":" + port + "/api/v1";
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    Response get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request);
    }

    Response post(String path, Object body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
        return send(request);
    }

    String baseUrl() {
        return baseUrl;
    }

    private Response send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        String text = response.body();
        JsonNode body = text == null || text.isBlank()
                ? objectMapper.missingNode()
                : objectMapper.readTree(text);
        return new Response(response.statusCode(), body);
    }
}
