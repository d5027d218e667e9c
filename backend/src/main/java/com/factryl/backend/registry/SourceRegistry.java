package com.factryl.backend.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Lookup table from source name to credibility metadata. Names are matched
 * case-insensitively; unknown names resolve to the fallback record.
 */
public class SourceRegistry {

    private final Map<String, SourceCredibility> sources;
    private final SourceCredibility fallback;

    public SourceRegistry(Map<String, SourceCredibility> sources) {
        this(sources, SourceCredibility.UNKNOWN);
    }

    public SourceRegistry(Map<String, SourceCredibility> sources, SourceCredibility fallback) {
        Map<String, SourceCredibility> normalized = new LinkedHashMap<>();
        if (sources != null) {
            sources.forEach((name, credibility) -> normalized.put(key(name), credibility));
        }
        this.sources = Collections.unmodifiableMap(normalized);
        this.fallback = fallback != null ? fallback : SourceCredibility.UNKNOWN;
    }

    public SourceCredibility lookup(String sourceName) {
        if (sourceName == null) {
            return fallback;
        }
        return sources.getOrDefault(key(sourceName), fallback);
    }

    public boolean isKnown(String sourceName) {
        return sourceName != null && sources.containsKey(key(sourceName));
    }

    public Map<String, SourceCredibility> all() {
        return sources;
    }

    public SourceCredibility getFallback() {
        return fallback;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
