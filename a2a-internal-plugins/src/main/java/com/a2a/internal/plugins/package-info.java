/**
 * Builtin plugin table: the providers (echo, ollama, openai, azure_openai) and frameworks
 * (native, langchain4j) compiled into the agent, plus community JAR loading.
 * The bootstrap builds its plugin locators from {@link com.a2a.internal.plugins.InternalPlugins}.
 */
package com.a2a.internal.plugins;
