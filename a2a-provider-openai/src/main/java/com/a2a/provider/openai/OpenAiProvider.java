package com.a2a.provider.openai;

import com.a2a.annotations.A2aPlugin;
import com.a2a.message.ChatMessage;
import com.a2a.message.Messages;
import com.a2a.provider.Provider;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * OpenAI chat/completions provider ({@code OPENAI_API_KEY}, {@code OPENAI_MODEL} default
 * "gpt-4o-mini", {@code OPENAI_BASE_URL} default "https://api.openai.com/v1"). Uses the
 * non-blocking HTTP client, so calls complete on the client's own threads.
 * Not ready when the API key is unset.
 */
@A2aPlugin(id = "openai", slot = "providers", displayName = "OpenAI", description = "OpenAI chat/completions API")
public final class OpenAiProvider implements Provider {

    static final String ENV_API_KEY = "OPENAI_API_KEY";
    static final String ENV_MODEL = "OPENAI_MODEL";
    static final String ENV_BASE_URL = "OPENAI_BASE_URL";
    static final String DEFAULT_MODEL = "gpt-4o-mini";
    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private final String model;
    private final ChatCompletionsClient client;
    private final String reason;

    public OpenAiProvider() {
        this(System.getenv());
    }

    OpenAiProvider(Map<String, String> env) {
        String apiKey = env.get(ENV_API_KEY);
        String m = env.get(ENV_MODEL);
        String base = env.get(ENV_BASE_URL);
        this.model = m != null && !m.isBlank() ? m.trim() : DEFAULT_MODEL;
        if (apiKey == null || apiKey.isBlank()) {
            this.client = null;
            this.reason = ENV_API_KEY + " not set";
            return;
        }
        String baseUrl = (base != null && !base.isBlank() ? base.trim() : DEFAULT_BASE_URL).replaceAll("/+$", "");
        this.client = new ChatCompletionsClient(URI.create(baseUrl + "/chat/completions"),
                Map.of("Authorization", "Bearer " + apiKey.trim()), "openai");
        this.reason = "OpenAI ready (model=" + model + ")";
    }

    @Override
    public String getId() {
        return "openai";
    }

    @Override
    public String getDisplayName() {
        return "OpenAI";
    }

    @Override
    public boolean isReady() {
        return client != null;
    }

    @Override
    public String getReason() {
        return reason;
    }

    String getModel() {
        return model;
    }

    @Override
    public CompletionStage<String> generate(String prompt, List<ChatMessage> messages) {
        if (client == null) {
            return CompletableFuture.completedFuture("[openai not ready] " + reason);
        }
        return client.complete(model, Messages.promptOrLastUserText(prompt, messages, "Say hello."), null);
    }
}
