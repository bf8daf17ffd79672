package com.a2a.provider.ollama;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Ollama /api/generate request body. */
final class OllamaGenerateRequest {

    private final String model;
    private final String prompt;
    @JsonProperty("stream")
    private final boolean stream;

    OllamaGenerateRequest(String model, String prompt, boolean stream) {
        this.model = model;
        this.prompt = prompt;
        this.stream = stream;
    }

    public String getModel() { return model; }
    public String getPrompt() { return prompt; }
    public boolean isStream() { return stream; }
}
