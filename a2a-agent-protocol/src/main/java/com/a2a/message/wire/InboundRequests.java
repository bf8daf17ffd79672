package com.a2a.message.wire;

import com.a2a.message.ChatMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Normalizes the three gateway envelopes into a message list. Only what is needed to reach the user
 * text is read; anything malformed yields an empty list.
 */
public final class InboundRequests {

    public static final String METHOD_MESSAGE_SEND = "message/send";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private InboundRequests() {
    }

    /**
     * Guesses the envelope: a {@code messages} array means chat-completions, a {@code jsonrpc}
     * member means JSON-RPC, a {@code params.message} object means A2A.
     */
    public static Optional<WireShape> detect(JsonNode body) {
        if (body == null || !body.isObject()) return Optional.empty();
        if (body.path("messages").isArray()) return Optional.of(WireShape.CHAT_COMPLETIONS);
        if (body.has("jsonrpc")) return Optional.of(WireShape.JSON_RPC);
        if (body.path("params").path("message").isObject()) return Optional.of(WireShape.A2A);
        return Optional.empty();
    }

    /**
     * Parses a JSON body of the given shape. Invalid JSON yields an empty list.
     */
    public static List<ChatMessage> toMessages(WireShape shape, String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return toMessages(shape, MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            return List.of();
        }
    }

    public static List<ChatMessage> toMessages(WireShape shape, JsonNode body) {
        if (shape == null || body == null || !body.isObject()) return List.of();
        switch (shape) {
            case CHAT_COMPLETIONS:
                return readMessageArray(body.path("messages"));
            case JSON_RPC:
            case A2A:
                return readEnvelopeMessage(body.path("params").path("message"));
            default:
                return List.of();
        }
    }

    /** Request id of a JSON-RPC envelope (string or number), if present. */
    public static Optional<JsonNode> jsonRpcId(JsonNode body) {
        if (body == null) return Optional.empty();
        JsonNode id = body.get("id");
        return id != null && !id.isNull() ? Optional.of(id) : Optional.empty();
    }

    private static List<ChatMessage> readMessageArray(JsonNode array) {
        if (!array.isArray()) return List.of();
        List<ChatMessage> out = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            ChatMessage m = readMessage(node);
            if (m != null) out.add(m);
        }
        return out;
    }

    private static List<ChatMessage> readEnvelopeMessage(JsonNode message) {
        ChatMessage m = readMessage(message);
        return m != null ? List.of(m) : List.of();
    }

    private static ChatMessage readMessage(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        try {
            return MAPPER.treeToValue(node, ChatMessage.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return null;
        }
    }
}
