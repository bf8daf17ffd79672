package com.a2a.framework;

import com.a2a.plugin.AliasTable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Friendly framework names to registry ids.
 */
public final class FrameworkAliases {

    public static final AliasTable TABLE = AliasTable.of(table());

    private FrameworkAliases() {
    }

    public static String resolve(String name) {
        return TABLE.resolve(name);
    }

    private static Map<String, String> table() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("native", "native");
        m.put("direct", "native");
        m.put("langchain4j", "langchain4j");
        m.put("langchain", "langchain4j");
        m.put("lc", "langchain4j");
        m.put("lc4j", "langchain4j");
        m.put("langgraph", "langgraph");
        m.put("lg", "langgraph");
        m.put("crewai", "crewai");
        m.put("crew", "crewai");
        m.put("crew.ai", "crewai");
        m.put("beeai", "beeai");
        m.put("bee.ai", "beeai");
        m.put("beeai_framework", "beeai");
        return m;
    }
}
