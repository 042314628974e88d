package com.alertsentinel.core.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for channels that POST a JSON document to an HTTP endpoint.
 *
 * <p>
 * Any 2xx status counts as delivered. Other statuses become a failure
 * result carrying the status code and the start of the response body.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AbstractHttpChannel extends AbstractNotificationChannel {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractHttpChannel.class);

    private static final String CONTENT_TYPE = "application/json";
    private static final int MAX_ERROR_BODY = 200;

    protected AbstractHttpChannel(NotificationConfig config, ChannelSupport support) {
        super(config, support);
    }

    /**
     * @return endpoint to POST to; only called after config validation
     */
    protected abstract String targetUrl();

    /**
     * @param payload the alert
     * @return object serialized with the shared Jackson mapper as the body
     */
    protected abstract Object requestBody(NotificationPayload payload);

    /**
     * Extra request headers. The default reads an optional {@code headers}
     * map from the channel config.
     */
    protected Map<String, String> headers() {
        Object raw = config.getConfig().get("headers");
        if (raw instanceof Map<?, ?> map) {
            Map<String, String> headers = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                if (k != null && v != null) {
                    headers.put(k.toString(), v.toString());
                }
            });
            return headers;
        }
        return Map.of();
    }

    @Override
    protected CompletableFuture<NotificationResult> deliver(NotificationPayload payload) {
        String json;
        try {
            json = support.objectMapper().writeValueAsString(requestBody(payload));
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(
                    failure("Failed to serialize notification: " + e.getOriginalMessage()));
        }

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(targetUrl()))
                .header("Content-Type", CONTENT_TYPE)
                .timeout(support.requestTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        headers().forEach(request::header);

        return support.httpClient()
                .sendAsync(request.build(), HttpResponse.BodyHandlers.ofString())
                .thenApply(this::toResult);
    }

    private NotificationResult toResult(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            LOG.debug("Channel [{}] delivered: HTTP {}", getId(), status);
            return success();
        }
        String body = response.body() == null ? "" : response.body();
        if (body.length() > MAX_ERROR_BODY) {
            body = body.substring(0, MAX_ERROR_BODY) + "...";
        }
        return failure(body.isBlank() ? "HTTP " + status : "HTTP " + status + ": " + body);
    }
}
