package com.a2a.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agent entry point: bootstraps the core, logs the plugin listings and readiness, and keeps the
 * context until shutdown. The HTTP routes attach to {@link AgentGateway}.
 */
public final class AgentApplication {

    private static final Logger log = LoggerFactory.getLogger(AgentApplication.class);

    private AgentApplication() {
    }

    public static void main(String[] args) {
        AgentContext ctx = AgentBootstrap.initialize();
        Runtime.getRuntime().addShutdownHook(new Thread(ctx::close, "a2a-shutdown"));

        log.info("{} {} starting", ctx.getConfig().getAgentName(), ctx.getConfig().getAgentVersion());
        log.info("Providers: {}", ctx.getProviderRegistry().listProviders());
        log.info("Frameworks: {}", ctx.getFrameworkRegistry().listFrameworks());
        log.info("Readiness: {}", ctx.readiness());
        if (!ctx.isReady()) {
            log.warn("Agent is not ready; replies will carry diagnostics until the plugin configuration is fixed");
        }
    }
}
