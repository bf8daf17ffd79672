package com.a2a.provider.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Ollama /api/generate response (non-streaming). Ignores extra fields (created_at, done, context, etc.). */
@JsonIgnoreProperties(ignoreUnknown = true)
final class OllamaGenerateResponse {

    private String model;
    private String response;

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public String getResponse() { return response; }
    public void setResponse(String response) { this.response = response; }
}
