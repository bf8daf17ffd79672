package com.a2a.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Non-blocking client for the chat/completions wire format shared by OpenAI and Azure OpenAI.
 * Sends one user message and reads {@code choices[0].message.content}. Failures never complete the
 * future exceptionally; they become {@code "[<tag> error] <details>"} text.
 */
final class ChatCompletionsClient {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionsClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI endpoint;
    private final Map<String, String> headers;
    private final String errorTag;
    private final HttpClient httpClient;

    ChatCompletionsClient(URI endpoint, Map<String, String> headers, String errorTag) {
        this.endpoint = endpoint;
        this.headers = Map.copyOf(headers);
        this.errorTag = errorTag;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    URI getEndpoint() {
        return endpoint;
    }

    /**
     * @param model       model name, omitted from the body when null (Azure deployments carry it)
     * @param userText    the single user message
     * @param temperature sampling temperature, omitted when null
     */
    CompletableFuture<String> complete(String model, String userText, Double temperature) {
        HttpRequest request;
        try {
            request = buildRequest(model, userText, temperature);
        } catch (Exception e) {
            return CompletableFuture.completedFuture(errorText(e));
        }
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .thenApply(this::readReply)
                .exceptionally(this::errorText);
    }

    private HttpRequest buildRequest(String model, String userText, Double temperature) throws Exception {
        ObjectNode body = MAPPER.createObjectNode();
        if (model != null) {
            body.put("model", model);
        }
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", userText);
        if (temperature != null) {
            body.put("temperature", temperature);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(endpoint)
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(60))
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8));
        headers.forEach(builder::header);
        return builder.build();
    }

    private String readReply(HttpResponse<String> response) {
        if (response.statusCode() / 100 != 2) {
            throw new IllegalStateException("HTTP " + response.statusCode() + ": " + response.body());
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(response.body());
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable response: " + e.getMessage(), e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText().trim() : "";
    }

    private String errorText(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String message = cause.getMessage();
        String details = message != null && !message.isBlank() ? message : cause.getClass().getName();
        log.warn("{} call to {} failed: {}", errorTag, endpoint, details);
        return "[" + errorTag + " error] " + details;
    }
}
