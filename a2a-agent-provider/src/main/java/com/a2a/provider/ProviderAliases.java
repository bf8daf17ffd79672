package com.a2a.provider;

import com.a2a.plugin.AliasTable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Friendly provider names to registry ids (e.g. "azure" to "azure_openai", "claude" to "anthropic").
 */
public final class ProviderAliases {

    public static final AliasTable TABLE = AliasTable.of(table());

    private ProviderAliases() {
    }

    public static String resolve(String name) {
        return TABLE.resolve(name);
    }

    private static Map<String, String> table() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("echo", "echo");
        m.put("openai", "openai");
        m.put("azure", "azure_openai");
        m.put("azure-openai", "azure_openai");
        m.put("azure_openai", "azure_openai");
        m.put("watsonx", "watsonx");
        m.put("ollama", "ollama");
        m.put("anthropic", "anthropic");
        m.put("claude", "anthropic");
        m.put("gemini", "gemini");
        m.put("google", "gemini");
        m.put("bedrock", "bedrock");
        return m;
    }
}
