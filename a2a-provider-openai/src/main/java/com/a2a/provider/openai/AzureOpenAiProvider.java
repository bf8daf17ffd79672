package com.a2a.provider.openai;

import com.a2a.annotations.A2aPlugin;
import com.a2a.message.ChatMessage;
import com.a2a.message.Messages;
import com.a2a.provider.Provider;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Azure OpenAI provider: {@code POST <AZURE_OPENAI_ENDPOINT>/openai/deployments/<deployment>/chat/completions}
 * with the {@code api-key} header. Needs AZURE_OPENAI_API_KEY, AZURE_OPENAI_ENDPOINT and
 * AZURE_OPENAI_DEPLOYMENT; AZURE_OPENAI_API_VERSION defaults to "2024-08-01-preview".
 */
@A2aPlugin(id = "azure_openai", slot = "providers", displayName = "Azure OpenAI",
        description = "Azure OpenAI deployment chat/completions API")
public final class AzureOpenAiProvider implements Provider {

    static final String ENV_API_KEY = "AZURE_OPENAI_API_KEY";
    static final String ENV_ENDPOINT = "AZURE_OPENAI_ENDPOINT";
    static final String ENV_DEPLOYMENT = "AZURE_OPENAI_DEPLOYMENT";
    static final String ENV_API_VERSION = "AZURE_OPENAI_API_VERSION";
    static final String DEFAULT_API_VERSION = "2024-08-01-preview";
    private static final double TEMPERATURE = 0.2;

    private final ChatCompletionsClient client;
    private final String reason;

    public AzureOpenAiProvider() {
        this(System.getenv());
    }

    AzureOpenAiProvider(Map<String, String> env) {
        String key = trimToNull(env.get(ENV_API_KEY));
        String endpoint = trimToNull(env.get(ENV_ENDPOINT));
        String deployment = trimToNull(env.get(ENV_DEPLOYMENT));
        String apiVersion = trimToNull(env.get(ENV_API_VERSION));
        if (key == null || endpoint == null || deployment == null) {
            this.client = null;
            this.reason = "Missing AZURE_OPENAI_API_KEY/ENDPOINT/DEPLOYMENT";
            return;
        }
        URI uri = URI.create(endpoint.replaceAll("/+$", "")
                + "/openai/deployments/" + URLEncoder.encode(deployment, StandardCharsets.UTF_8)
                + "/chat/completions?api-version="
                + URLEncoder.encode(apiVersion != null ? apiVersion : DEFAULT_API_VERSION, StandardCharsets.UTF_8));
        this.client = new ChatCompletionsClient(uri, Map.of("api-key", key), "azure openai");
        this.reason = "Azure OpenAI ready (deployment=" + deployment + ")";
    }

    @Override
    public String getId() {
        return "azure_openai";
    }

    @Override
    public String getDisplayName() {
        return "Azure OpenAI";
    }

    @Override
    public boolean isReady() {
        return client != null;
    }

    @Override
    public String getReason() {
        return reason;
    }

    URI getEndpoint() {
        return client != null ? client.getEndpoint() : null;
    }

    @Override
    public CompletionStage<String> generate(String prompt, List<ChatMessage> messages) {
        if (client == null) {
            return CompletableFuture.completedFuture("[azure openai not ready] " + reason);
        }
        return client.complete(null, Messages.promptOrLastUserText(prompt, messages, "Say hello."), TEMPERATURE);
    }

    private static String trimToNull(String s) {
        return s != null && !s.isBlank() ? s.trim() : null;
    }
}
