package com.paperbot.data.http;

import com.paperbot.core.CollaboratorException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Thin synchronous wrapper over the JDK HTTP client. Non-2xx answers and I/O failures surface
 * as {@link CollaboratorException}.
 */
public class HttpClientEx {
    private final HttpClient client;
    private final String userAgent;

    public HttpClientEx(String userAgent) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.userAgent = userAgent == null || userAgent.isBlank() ? "paperbot/1.0" : userAgent;
    }

    public String getText(String url, int timeoutSeconds) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("User-Agent", userAgent)
                .build();
        HttpResponse<String> resp = send(req, url);
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new CollaboratorException("HTTP " + resp.statusCode() + " for " + url);
    }

    /**
     * @return the response status; only 2xx is returned, anything else throws
     */
    public int postJson(String url, String json, int timeoutSeconds) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .header("Content-Type", "application/json")
                .header("User-Agent", userAgent)
                .build();
        // webhook URLs embed a secret token, log the host only
        HttpResponse<String> resp = send(req, URI.create(url).getHost());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.statusCode();
        String body = resp.body() == null ? "" : resp.body();
        throw new CollaboratorException("HTTP " + resp.statusCode() + " for POST " + URI.create(url).getHost() + ", body="
                + body.substring(0, Math.min(500, body.length())));
    }

    private HttpResponse<String> send(HttpRequest req, String target) {
        try {
            return client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CollaboratorException("request failed for " + target + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("request interrupted for " + target, e);
        }
    }
}
