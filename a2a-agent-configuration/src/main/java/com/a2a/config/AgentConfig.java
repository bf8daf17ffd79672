package com.a2a.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Configuration loaded from environment variables for the A2A agent.
 * <p>
 * Selection: LLM_PROVIDER (default {@value #DEFAULT_PROVIDER}), AGENT_FRAMEWORK (default
 * {@value #DEFAULT_FRAMEWORK}). Both are trimmed and lower-cased; alias resolution happens in the
 * registries. Plugins: A2A_PLUGINS_DIR (community JAR directory; unset = none). Pools:
 * A2A_PROVIDER_POOL_SIZE, A2A_ORCHESTRATION_POOL_SIZE.
 */
public final class AgentConfig {

    private static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    private static final String ENV_AGENT_FRAMEWORK = "AGENT_FRAMEWORK";
    private static final String ENV_PLUGINS_DIR = "A2A_PLUGINS_DIR";
    private static final String ENV_PROVIDER_POOL_SIZE = "A2A_PROVIDER_POOL_SIZE";
    private static final String ENV_ORCHESTRATION_POOL_SIZE = "A2A_ORCHESTRATION_POOL_SIZE";
    private static final String ENV_AGENT_NAME = "AGENT_NAME";
    private static final String ENV_AGENT_VERSION = "AGENT_VERSION";

    public static final String DEFAULT_PROVIDER = "echo";
    public static final String DEFAULT_FRAMEWORK = "native";
    private static final int DEFAULT_PROVIDER_POOL_SIZE = 8;
    private static final int DEFAULT_ORCHESTRATION_POOL_SIZE = 4;
    private static final String DEFAULT_AGENT_NAME = "Universal A2A Agent";
    private static final String DEFAULT_AGENT_VERSION = "1.2.0";

    private final String llmProvider;
    private final String agentFramework;
    private final Path pluginsDir;
    private final int providerPoolSize;
    private final int orchestrationPoolSize;
    private final String agentName;
    private final String agentVersion;

    private AgentConfig(Builder b) {
        this.llmProvider = normalizeSelection(b.llmProvider, DEFAULT_PROVIDER);
        this.agentFramework = normalizeSelection(b.agentFramework, DEFAULT_FRAMEWORK);
        this.pluginsDir = b.pluginsDir;
        this.providerPoolSize = b.providerPoolSize > 0 ? b.providerPoolSize : DEFAULT_PROVIDER_POOL_SIZE;
        this.orchestrationPoolSize = b.orchestrationPoolSize > 0 ? b.orchestrationPoolSize : DEFAULT_ORCHESTRATION_POOL_SIZE;
        this.agentName = b.agentName != null && !b.agentName.isBlank() ? b.agentName.trim() : DEFAULT_AGENT_NAME;
        this.agentVersion = b.agentVersion != null && !b.agentVersion.isBlank() ? b.agentVersion.trim() : DEFAULT_AGENT_VERSION;
    }

    /**
     * Normalizes a selection value: null/blank → {@code defaultValue}; otherwise trimmed and lower-cased.
     */
    public static String normalizeSelection(String value, String defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    /** Chosen provider id before alias resolution (LLM_PROVIDER). Never blank. */
    public String getLlmProvider() {
        return llmProvider;
    }

    /** Chosen framework id before alias resolution (AGENT_FRAMEWORK). Never blank. */
    public String getAgentFramework() {
        return agentFramework;
    }

    /** Community plugin JAR directory (A2A_PLUGINS_DIR), if configured. */
    public Optional<Path> getPluginsDir() {
        return Optional.ofNullable(pluginsDir);
    }

    /** Worker threads for blocking providers (A2A_PROVIDER_POOL_SIZE). Default 8. */
    public int getProviderPoolSize() {
        return providerPoolSize;
    }

    /** Worker threads for orchestration-backed frameworks (A2A_ORCHESTRATION_POOL_SIZE). Default 4. */
    public int getOrchestrationPoolSize() {
        return orchestrationPoolSize;
    }

    public String getAgentName() {
        return agentName;
    }

    public String getAgentVersion() {
        return agentVersion;
    }

    public static AgentConfig fromEnvironment() {
        return fromLookup(System::getenv);
    }

    /**
     * Builds config from a map of variable name → value (e.g. a parsed .env file, or tests).
     */
    public static AgentConfig fromMap(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        return fromLookup(values::get);
    }

    private static AgentConfig fromLookup(Function<String, String> env) {
        String pluginsDir = env.apply(ENV_PLUGINS_DIR);
        return builder()
                .llmProvider(env.apply(ENV_LLM_PROVIDER))
                .agentFramework(env.apply(ENV_AGENT_FRAMEWORK))
                .pluginsDir(pluginsDir != null && !pluginsDir.isBlank() ? Paths.get(pluginsDir.trim()) : null)
                .providerPoolSize(parseInt(env.apply(ENV_PROVIDER_POOL_SIZE), DEFAULT_PROVIDER_POOL_SIZE))
                .orchestrationPoolSize(parseInt(env.apply(ENV_ORCHESTRATION_POOL_SIZE), DEFAULT_ORCHESTRATION_POOL_SIZE))
                .agentName(env.apply(ENV_AGENT_NAME))
                .agentVersion(env.apply(ENV_AGENT_VERSION))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static final class Builder {
        private String llmProvider;
        private String agentFramework;
        private Path pluginsDir;
        private int providerPoolSize = DEFAULT_PROVIDER_POOL_SIZE;
        private int orchestrationPoolSize = DEFAULT_ORCHESTRATION_POOL_SIZE;
        private String agentName;
        private String agentVersion;

        private Builder() {
        }

        public Builder llmProvider(String llmProvider) {
            this.llmProvider = llmProvider;
            return this;
        }

        public Builder agentFramework(String agentFramework) {
            this.agentFramework = agentFramework;
            return this;
        }

        public Builder pluginsDir(Path pluginsDir) {
            this.pluginsDir = pluginsDir;
            return this;
        }

        public Builder providerPoolSize(int providerPoolSize) {
            this.providerPoolSize = providerPoolSize;
            return this;
        }

        public Builder orchestrationPoolSize(int orchestrationPoolSize) {
            this.orchestrationPoolSize = orchestrationPoolSize;
            return this;
        }

        public Builder agentName(String agentName) {
            this.agentName = agentName;
            return this;
        }

        public Builder agentVersion(String agentVersion) {
            this.agentVersion = agentVersion;
            return this;
        }

        public AgentConfig build() {
            return new AgentConfig(this);
        }
    }
}
