package com.taskflow.engine.action;

import com.taskflow.core.exception.ActionExecutionException;
import com.taskflow.core.model.ActionType;
import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.WorkflowAction;
import com.taskflow.engine.action.WebhookClient.WebhookRequest;
import com.taskflow.engine.action.WebhookClient.WebhookResponse;

import java.io.UncheckedIOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP call to the action target. Serves both {@code webhook} (POST by default)
 * and {@code api} (GET by default).
 *
 * Server errors and transport failures are retryable; any other non-2xx status is not.
 */
public class WebhookActionHandler implements ActionHandler {

    private final ActionType type;
    private final String defaultMethod;
    private final WebhookClient client;

    public WebhookActionHandler(ActionType type, String defaultMethod, WebhookClient client) {
        if (type != ActionType.WEBHOOK && type != ActionType.API) {
            throw new IllegalArgumentException("Not an HTTP action type: " + type);
        }
        this.type = type;
        this.defaultMethod = defaultMethod;
        this.client = client;
    }

    @Override
    public ActionType type() {
        return type;
    }

    @Override
    public Map<String, Object> execute(WorkflowAction action, ActionContext context) {
        if (!action.hasTarget()) {
            throw new ActionExecutionException(type, "target URL is required", false);
        }
        URI uri;
        try {
            uri = URI.create(action.target());
        } catch (IllegalArgumentException e) {
            throw new ActionExecutionException(type, "invalid target URL '" + action.target() + "'", false);
        }

        VariableMap params = action.params();
        String method = params.string("method").orElse(defaultMethod).toUpperCase(Locale.ROOT);
        Map<String, String> headers = new LinkedHashMap<>();
        Object rawHeaders = params.get("headers");
        if (rawHeaders instanceof Map<?, ?> map) {
            map.forEach((key, value) -> headers.put(String.valueOf(key), String.valueOf(value)));
        }

        WebhookResponse response;
        try {
            response = client.send(new WebhookRequest(method, uri, headers, params.get("body"), null));
        } catch (UncheckedIOException e) {
            throw new ActionExecutionException(type, e.getMessage(), e, true);
        }

        if (!response.isSuccessful()) {
            throw new ActionExecutionException(type,
                String.format("%s %s returned status %d", method, uri, response.statusCode()),
                response.isServerError());
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("status_code", response.statusCode());
        output.put("response_body", response.body());
        return output;
    }
}
