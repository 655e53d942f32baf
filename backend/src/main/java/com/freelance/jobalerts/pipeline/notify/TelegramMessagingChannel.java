package com.freelance.jobalerts.pipeline.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.model.ActionLink;
import com.freelance.jobalerts.pipeline.model.OutboundMessage;
import com.freelance.jobalerts.pipeline.model.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * Bot API channel. Maps {@code sendMessage} responses onto {@link SendResult}:
 * 429 carries {@code parameters.retry_after}, 403 and "chat not found" mark the recipient
 * unreachable, other 4xx reject only the message and 5xx or IO errors are transient.
 */
public class TelegramMessagingChannel implements MessagingChannel {
    private static final Logger log = LoggerFactory.getLogger(TelegramMessagingChannel.class);
    private static final int DEFAULT_RETRY_AFTER_SECONDS = 5;

    private final AlertsProperties.Telegram properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public TelegramMessagingChannel(AlertsProperties.Telegram properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public String name() {
        return "telegram";
    }

    @Override
    public SendResult send(long recipientId, OutboundMessage message) {
        String body;
        try {
            body = objectMapper.writeValueAsString(buildPayload(recipientId, message));
        } catch (JsonProcessingException e) {
            return SendResult.permanentFailure("payload_error");
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(endpoint("sendMessage")))
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            return SendResult.transientFailure("timeout");
        } catch (IOException e) {
            return SendResult.transientFailure("io_error");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SendResult.transientFailure("interrupted");
        }
        return mapResponse(recipientId, response.statusCode(), response.body());
    }

    SendResult mapResponse(long recipientId, int status, String body) {
        JsonNode json = parse(body);
        String description = json.path("description").asText("http_" + status);
        if (status == 200 && json.path("ok").asBoolean(false)) {
            return SendResult.ok();
        }
        if (status == 429) {
            int retryAfter = json.path("parameters").path("retry_after").asInt(DEFAULT_RETRY_AFTER_SECONDS);
            return SendResult.rateLimited(retryAfter);
        }
        if (status >= 500) {
            return SendResult.transientFailure("http_" + status);
        }
        if (status == 403 || description.toLowerCase(Locale.ROOT).contains("chat not found")) {
            log.warn("Recipient {} is unreachable: {}", recipientId, description);
            return SendResult.recipientUnreachable(description);
        }
        log.warn("Telegram rejected message for recipient {}: status={} description={}", recipientId, status, description);
        return SendResult.permanentFailure(description);
    }

    private ObjectNode buildPayload(long recipientId, OutboundMessage message) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("chat_id", recipientId);
        payload.put("text", message.text());
        payload.put("parse_mode", "HTML");
        payload.put("disable_web_page_preview", true);
        if (!message.links().isEmpty()) {
            ArrayNode keyboard = payload.putObject("reply_markup").putArray("inline_keyboard");
            for (ActionLink link : message.links()) {
                keyboard.addArray().addObject()
                    .put("text", link.label())
                    .put("url", link.url());
            }
        }
        return payload;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return objectMapper.createObjectNode();
        }
    }

    private String endpoint(String method) {
        return properties.getApiBaseUrl() + "/bot" + properties.getBotToken() + "/" + method;
    }
}
