package com.shipyard.orchestrator.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipyard.orchestrator.error.CollaboratorException;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Shared plumbing for the JSON-over-HTTP collaborator clients.
 *
 * Uses java.net.http.HttpClient so every header and byte on the wire is
 * explicit. Non-2xx responses and transport errors become
 * {@link CollaboratorException}, carrying the HTTP status when there was one.
 */
public abstract class CollaboratorHttpClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final HttpClient   http;
    protected final ObjectMapper json;
    protected final String       baseUrl;

    protected CollaboratorHttpClient(String baseUrl, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    protected String get(String path, String opName) {
        return send(request(path).GET().build(), opName);
    }

    protected String post(String path, Object body, String opName) {
        return send(request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build(), opName);
    }

    protected String delete(String path, String opName) {
        return send(request(path).DELETE().build(), opName);
    }

    /** Fire-and-forget POST; the future completes with the status code or exceptionally. */
    protected CompletableFuture<Integer> postAsync(String path, Object body) {
        HttpRequest req = request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();
        return http.sendAsync(req, HttpResponse.BodyHandlers.discarding())
                .thenApply(HttpResponse::statusCode);
    }

    protected <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Failed to parse " + opName + " response", e);
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(DEFAULT_TIMEOUT)
                .header("Accept", "application/json");
    }

    private String send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new CollaboratorException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body(), resp.statusCode());
            }
            return resp.body();
        } catch (CollaboratorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new CollaboratorException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("JSON serialization failed", e);
        }
    }
}
