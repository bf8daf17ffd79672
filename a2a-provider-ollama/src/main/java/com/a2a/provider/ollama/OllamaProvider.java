package com.a2a.provider.ollama;

import com.a2a.annotations.A2aPlugin;
import com.a2a.annotations.ResourceCleanup;
import com.a2a.message.ChatMessage;
import com.a2a.message.Messages;
import com.a2a.provider.BlockingProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Provider that calls a local Ollama daemon: {@code POST <OLLAMA_BASE_URL>/api/generate} with the
 * model ({@code OLLAMA_MODEL}, default "llama3") and the prompt only. The HTTP call blocks, so it
 * runs on the shared provider pool.
 * <p>
 * Reported ready without contacting the daemon; connection and HTTP errors come back as
 * {@code "[ollama error] <details>"} replies.
 */
@A2aPlugin(id = "ollama", slot = "providers", displayName = "Ollama", description = "Local Ollama daemon via /api/generate")
public final class OllamaProvider extends BlockingProvider implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(OllamaProvider.class);

    static final String ENV_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_MODEL = "OLLAMA_MODEL";
    static final String DEFAULT_BASE_URL = "http://localhost:11434";
    static final String DEFAULT_MODEL = "llama3";
    static final String FALLBACK_PROMPT = "Say hello.";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String model;
    private final HttpClient httpClient;

    /** Reads OLLAMA_BASE_URL and OLLAMA_MODEL from the environment. */
    public OllamaProvider() {
        this(System.getenv());
    }

    OllamaProvider(Map<String, String> env) {
        String base = env.get(ENV_BASE_URL);
        String m = env.get(ENV_MODEL);
        this.baseUrl = stripTrailingSlash(base != null && !base.isBlank() ? base.trim() : DEFAULT_BASE_URL);
        this.model = m != null && !m.isBlank() ? m.trim() : DEFAULT_MODEL;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String getId() {
        return "ollama";
    }

    @Override
    public String getDisplayName() {
        return "Ollama";
    }

    @Override
    public boolean isReady() {
        return true;
    }

    @Override
    public String getReason() {
        return "Ollama ready (model=" + model + ")";
    }

    String getBaseUrl() {
        return baseUrl;
    }

    String getModel() {
        return model;
    }

    @Override
    protected String generateBlocking(String prompt, List<ChatMessage> messages) {
        String text = Messages.promptOrLastUserText(prompt, messages, FALLBACK_PROMPT);
        try {
            return callGenerate(text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "[ollama error] interrupted";
        } catch (Exception e) {
            log.warn("Ollama call to {} failed: {}", baseUrl, e.toString());
            return "[ollama error] " + describe(e);
        }
    }

    private String callGenerate(String prompt) throws Exception {
        String json = MAPPER.writeValueAsString(new OllamaGenerateRequest(model, prompt, false));
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/api/generate"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(30))
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() != 200) {
            throw new IllegalStateException("Ollama API error: " + response.statusCode() + " " + response.body());
        }
        OllamaGenerateResponse resp = MAPPER.readValue(response.body(), OllamaGenerateResponse.class);
        String text = resp != null && resp.getResponse() != null ? resp.getResponse().trim() : "";
        return text.isEmpty() ? "Empty response from Ollama." : text;
    }

    @Override
    public void onExit() {
        // HttpClient is not AutoCloseable in Java 17; nothing to release
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getName();
    }

    private static String stripTrailingSlash(String url) {
        String out = url;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
