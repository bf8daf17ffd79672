package com.a2a.bootstrap;

import com.a2a.config.AgentConfig;
import com.a2a.provider.CallOutcome;
import com.a2a.provider.DispatchMetrics;
import com.a2a.provider.ProviderExecutors;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentBootstrapTest {

    private AgentContext ctx;

    @AfterEach
    void tearDown() {
        if (ctx != null) {
            ctx.close();
        }
    }

    @Test
    void initialize_defaultsToEchoAndNative() {
        ctx = AgentBootstrap.initialize(AgentConfig.fromMap(Map.of()));

        assertEquals("echo", ctx.getProvider().getId());
        assertEquals("native", ctx.getFramework().getId());
        assertSame(ctx.getProvider(), ctx.getFramework().getProvider());
        assertSame(ctx.getProvider(), ctx.getProviderRegistry().provider());
        assertTrue(ctx.isReady());
    }

    @Test
    void initialize_unknownProviderFallsBackToEcho() {
        ctx = AgentBootstrap.initialize(AgentConfig.builder().llmProvider("no-such-backend").build());

        assertEquals("echo", ctx.getProvider().getId());
        assertTrue(ctx.getProvider().isReady());
    }

    @Test
    void initialize_aliasSelectsLangchain4j() throws Exception {
        ctx = AgentBootstrap.initialize(AgentConfig.builder().agentFramework("LC").build());

        assertEquals("langchain4j", ctx.getFramework().getId());
        assertEquals("Hello, you said: hi",
                new AgentGateway(ctx).reply("{\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                        .get(10, TimeUnit.SECONDS));
    }

    @Test
    void initialize_listsBuiltinPlugins() {
        ctx = AgentBootstrap.initialize(AgentConfig.fromMap(Map.of()));

        assertTrue(ctx.getProviderRegistry().listProviders().keySet().containsAll(
                List.of("echo", "ollama", "openai", "azure_openai")));
        assertTrue(ctx.getFrameworkRegistry().listFrameworks().keySet().containsAll(
                List.of("native", "langchain4j")));
    }

    @Test
    @SuppressWarnings("unchecked")
    void readiness_reportsProviderAndFramework() {
        ctx = AgentBootstrap.initialize(AgentConfig.fromMap(Map.of()));

        Map<String, Object> report = ctx.readiness();
        assertEquals("ready", report.get("status"));
        Map<String, Object> provider = (Map<String, Object>) report.get("provider");
        assertEquals("echo", provider.get("id"));
        assertEquals(Boolean.TRUE, provider.get("ready"));
        assertEquals("Echo provider is always ready.", provider.get("reason"));
        Map<String, Object> framework = (Map<String, Object>) report.get("framework");
        assertEquals("native", framework.get("id"));
    }

    @Test
    void initialize_bindsDispatchMetrics() throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ctx = AgentBootstrap.initialize(AgentConfig.fromMap(Map.of()), registry);

        new AgentGateway(ctx).reply("{\"messages\":[{\"role\":\"user\",\"content\":\"count me\"}]}")
                .get(10, TimeUnit.SECONDS);

        assertSame(registry, DispatchMetrics.registry());
        assertSame(registry, ctx.getMeterRegistry());
        assertTrue(DispatchMetrics.count("echo", CallOutcome.Status.OK) >= 1.0);
    }

    @Test
    void initialize_sizesOrchestrationPoolFromConfig() throws Exception {
        ctx = AgentBootstrap.initialize(AgentConfig.builder()
                .agentFramework("langchain4j")
                .orchestrationPoolSize(3)
                .build());

        new AgentGateway(ctx).reply("{\"messages\":[{\"role\":\"user\",\"content\":\"size\"}]}")
                .get(10, TimeUnit.SECONDS);

        assertEquals(3, ((ThreadPoolExecutor) ProviderExecutors.orchestration()).getMaximumPoolSize());
    }

    @Test
    void close_stopsSharedPools() {
        ctx = AgentBootstrap.initialize(AgentConfig.builder().agentFramework("langchain4j").build());
        ExecutorService orchestration = ProviderExecutors.orchestration();
        ExecutorService providers = ProviderExecutors.shared();

        ctx.close();

        assertTrue(orchestration.isShutdown());
        assertTrue(providers.isShutdown());
    }

    @Test
    void close_isIdempotent() {
        ctx = AgentBootstrap.initialize(AgentConfig.builder().agentFramework("langchain4j").build());

        ctx.close();
        ctx.close();
    }
}
