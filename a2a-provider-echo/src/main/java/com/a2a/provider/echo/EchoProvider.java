package com.a2a.provider.echo;

import com.a2a.annotations.A2aPlugin;
import com.a2a.message.ChatMessage;
import com.a2a.provider.Provider;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Always-ready provider that echoes the prompt. Default provider and last resort of the registry.
 */
@A2aPlugin(id = "echo", slot = "providers", displayName = "Echo", description = "Replies with the prompt it was given")
public final class EchoProvider implements Provider {

    @Override
    public String getId() {
        return "echo";
    }

    @Override
    public String getDisplayName() {
        return "Echo";
    }

    @Override
    public boolean isReady() {
        return true;
    }

    @Override
    public String getReason() {
        return "Echo provider is always ready.";
    }

    @Override
    public boolean supportsMessages() {
        return true;
    }

    @Override
    public CompletionStage<String> generate(String prompt, List<ChatMessage> messages) {
        String p = prompt == null ? "" : prompt.trim();
        return CompletableFuture.completedFuture(p.isEmpty() ? "Hello, World!" : "Hello, you said: " + p);
    }
}
