package com.a2a.provider;

import com.a2a.message.ChatMessage;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Text-generation backend. Every provider exposes one non-blocking entry point; backends whose
 * client blocks extend {@link BlockingProvider}, which moves the blocking call off the caller's
 * thread. Callers should go through {@link ProviderCalls} so failures become diagnostic text.
 * <p>
 * A provider that cannot work (missing credentials, missing library) reports {@code ready=false}
 * with a {@link #getReason() reason} and still answers {@link #generate} with a diagnostic string.
 */
public interface Provider {

    /** Stable short id (e.g. "echo", "azure_openai"). */
    String getId();

    /** Human-friendly name. */
    default String getDisplayName() {
        return getId();
    }

    boolean isReady();

    /** Diagnostic text; non-null when {@link #isReady()} is false. */
    default String getReason() {
        return null;
    }

    /** Whether the backend consumes the full conversation rather than the prompt only. */
    default boolean supportsMessages() {
        return false;
    }

    /**
     * Generates a reply.
     *
     * @param prompt   prompt text, usually the last user message
     * @param messages full conversation, oldest first; may be empty
     * @return stage completing with the reply text
     */
    CompletionStage<String> generate(String prompt, List<ChatMessage> messages);
}
