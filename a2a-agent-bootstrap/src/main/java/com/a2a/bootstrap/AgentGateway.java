package com.a2a.bootstrap;

import com.a2a.framework.Framework;
import com.a2a.message.ChatMessage;
import com.a2a.message.wire.InboundRequests;
import com.a2a.message.wire.WireShape;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Seam between the HTTP routes and the core: normalizes an inbound body into a message list and
 * runs it through the active framework. Degraded replies (bracket-tagged text) are ordinary
 * replies here.
 */
public final class AgentGateway {

    private static final Logger log = LoggerFactory.getLogger(AgentGateway.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Framework framework;

    public AgentGateway(Framework framework) {
        this.framework = Objects.requireNonNull(framework, "framework");
    }

    public AgentGateway(AgentContext context) {
        this(context.getFramework());
    }

    /** Replies to a body of a known wire shape. */
    public CompletableFuture<String> reply(WireShape shape, JsonNode body) {
        List<ChatMessage> messages = InboundRequests.toMessages(shape, body);
        log.debug("{} request with {} message(s) via framework {}", shape, messages.size(), framework.getId());
        return framework.execute(messages).toCompletableFuture();
    }

    public CompletableFuture<String> reply(WireShape shape, String json) {
        return reply(shape, readTree(json));
    }

    /**
     * Detects the wire shape of {@code json} and replies.
     *
     * @throws IllegalArgumentException when the body is not JSON or matches no supported shape
     */
    public CompletableFuture<String> reply(String json) {
        JsonNode body = readTree(json);
        WireShape shape = InboundRequests.detect(body)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported request payload"));
        return reply(shape, body);
    }

    private static JsonNode readTree(String json) {
        try {
            return MAPPER.readTree(json != null ? json : "");
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid JSON body: " + e.getMessage(), e);
        }
    }
}
