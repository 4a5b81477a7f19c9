package com.taskflow.engine.action;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Outbound HTTP port for webhook and api actions.
 */
public interface WebhookClient {

    /**
     * Send a request and return the response, whatever its status.
     *
     * @throws java.io.UncheckedIOException on transport failure
     */
    WebhookResponse send(WebhookRequest request);

    record WebhookRequest(
        String method,
        URI uri,
        Map<String, String> headers,
        Object body,
        Duration timeout
    ) {}

    record WebhookResponse(int statusCode, String body) {

        public boolean isSuccessful() {
            return statusCode >= 200 && statusCode < 300;
        }

        public boolean isServerError() {
            return statusCode >= 500;
        }
    }
}
