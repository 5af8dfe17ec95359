package org.apipulse.notifications;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.apipulse.execution.TransportErrors;
import org.apipulse.model.IntegrationType;
import org.apipulse.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * POSTs JSON documents to channel endpoints and insists on a 2xx answer.
 */
public class JsonPostClient {

    private static final Logger logger = LoggerFactory.getLogger(JsonPostClient.class);
    private static final int MAX_ERROR_BODY = 300;

    private final HttpClient client;
    private final Duration timeout;

    public JsonPostClient(HttpClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    public static JsonPostClient create(int timeoutSeconds) {
        HttpClient client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(timeoutSeconds))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new JsonPostClient(client, Duration.ofSeconds(timeoutSeconds));
    }

    public void post(IntegrationType channel, String url, JsonNode payload, Map<String, String> headers)
            throws ChannelDeliveryException {
        String json;
        try {
            json = JsonUtil.mapper().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ChannelDeliveryException(channel, "Could not serialise payload: " + e.getOriginalMessage(), e);
        }

        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(URI.create(url));
        } catch (IllegalArgumentException e) {
            throw new ChannelDeliveryException(channel, "Invalid endpoint URL: " + e.getMessage(), e);
        }
        builder.timeout(timeout)
                .header("Content-Type", "application/json; charset=UTF-8")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        headers.forEach(builder::header);

        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ChannelDeliveryException(channel, TransportErrors.describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelDeliveryException(channel, "Interrupted while sending", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String body = response.body() == null ? "" : response.body();
            if (body.length() > MAX_ERROR_BODY) body = body.substring(0, MAX_ERROR_BODY) + "...";
            throw new ChannelDeliveryException(channel, "Endpoint answered HTTP " + status + (body.isBlank() ? "" : ": " + body));
        }
        logger.debug("{} endpoint accepted payload with HTTP {}", channel.code(), status);
    }
}
