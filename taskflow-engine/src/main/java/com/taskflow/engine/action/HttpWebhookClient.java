package com.taskflow.engine.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link WebhookClient} on top of {@link HttpClient}. Non-string bodies are sent as JSON.
 */
public class HttpWebhookClient implements WebhookClient {

    private static final Logger log = LoggerFactory.getLogger(HttpWebhookClient.class);
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpWebhookClient(ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build(), objectMapper);
    }

    public HttpWebhookClient(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public WebhookResponse send(WebhookRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(request.uri())
            .timeout(request.timeout() != null ? request.timeout() : DEFAULT_TIMEOUT)
            .method(request.method(), bodyPublisher(request.body()));
        if (request.body() != null && !(request.body() instanceof String)) {
            builder.header("Content-Type", "application/json");
        }
        if (request.headers() != null) {
            request.headers().forEach(builder::header);
        }

        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            log.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
            return new WebhookResponse(response.statusCode(), response.body());
        } catch (IOException e) {
            throw new UncheckedIOException("HTTP call to " + request.uri() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UncheckedIOException("HTTP call to " + request.uri() + " interrupted", new IOException(e));
        }
    }

    private HttpRequest.BodyPublisher bodyPublisher(Object body) {
        if (body == null) {
            return HttpRequest.BodyPublishers.noBody();
        }
        if (body instanceof String text) {
            return HttpRequest.BodyPublishers.ofString(text);
        }
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize webhook body", e);
        }
    }
}
