package com.codesmith.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * JSON-over-HTTP plumbing shared by the agent clients.
 *
 * Blocking calls on java.net.http.HttpClient; the worker thread pool is
 * where they run. Every failure surfaces as a {@link ClientException}.
 */
abstract class JsonHttpClient {

    protected final HttpClient   http;
    protected final ObjectMapper json;
    protected final String       baseUrl;

    protected JsonHttpClient(String baseUrl, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** POST a JSON body and return the response body. */
    protected String post(String path, Object body, String opName, Duration timeout) {
        return post(path, body, opName, timeout, Map.of());
    }

    protected String post(String path, Object body, String opName, Duration timeout,
                          Map<String, String> headers) {
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(body)));
            headers.forEach(req::header);
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ClientException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body(), resp.statusCode());
            }
            return resp.body();
        } catch (ClientException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ClientException(opName + " failed", e);
        }
    }

    protected <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ClientException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ClientException("JSON serialization failed", e);
        }
    }
}
