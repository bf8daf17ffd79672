package com.a2a.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentConfigTest {

    @Test
    void fromMap_emptyUsesDefaults() {
        AgentConfig config = AgentConfig.fromMap(Map.of());

        assertEquals("echo", config.getLlmProvider());
        assertEquals("native", config.getAgentFramework());
        assertFalse(config.getPluginsDir().isPresent());
        assertEquals(8, config.getProviderPoolSize());
        assertEquals(4, config.getOrchestrationPoolSize());
        assertEquals("Universal A2A Agent", config.getAgentName());
    }

    @Test
    void fromMap_selectionIsTrimmedAndLowerCased() {
        AgentConfig config = AgentConfig.fromMap(Map.of(
                "LLM_PROVIDER", "  Claude ",
                "AGENT_FRAMEWORK", "LangChain4j"));

        assertEquals("claude", config.getLlmProvider());
        assertEquals("langchain4j", config.getAgentFramework());
    }

    @Test
    void fromMap_blankSelectionFallsBackToDefault() {
        AgentConfig config = AgentConfig.fromMap(Map.of("LLM_PROVIDER", "   ", "AGENT_FRAMEWORK", ""));

        assertEquals(AgentConfig.DEFAULT_PROVIDER, config.getLlmProvider());
        assertEquals(AgentConfig.DEFAULT_FRAMEWORK, config.getAgentFramework());
    }

    @Test
    void fromMap_invalidPoolSizeFallsBackToDefault() {
        AgentConfig config = AgentConfig.fromMap(Map.of(
                "A2A_PROVIDER_POOL_SIZE", "many",
                "A2A_ORCHESTRATION_POOL_SIZE", "-2"));

        assertEquals(8, config.getProviderPoolSize());
        assertEquals(4, config.getOrchestrationPoolSize());
    }

    @Test
    void fromMap_readsPluginsDirAndPoolSizes() {
        AgentConfig config = AgentConfig.fromMap(Map.of(
                "A2A_PLUGINS_DIR", " /opt/a2a/plugins ",
                "A2A_PROVIDER_POOL_SIZE", "2",
                "AGENT_NAME", "Hello Agent"));

        assertTrue(config.getPluginsDir().isPresent());
        assertEquals(Paths.get("/opt/a2a/plugins"), config.getPluginsDir().get());
        assertEquals(2, config.getProviderPoolSize());
        assertEquals("Hello Agent", config.getAgentName());
    }
}
