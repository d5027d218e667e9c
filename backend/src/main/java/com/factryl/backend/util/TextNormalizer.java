package com.factryl.backend.util;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.util.DigestUtils;

/**
 * Text and URL canonicalisation shared by id generation and duplicate detection.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final List<String> TRACKING_PARAM_PREFIXES = List.of("utm_", "ref", "source", "medium");

    private TextNormalizer() {
    }

    /**
     * Lowercase, collapse whitespace, strip punctuation.
     */
    public static String normalizeText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ").trim();
        return PUNCTUATION.matcher(normalized).replaceAll("");
    }

    /**
     * Lowercase, drop tracking query parameters, trailing slashes and the {@code www.} host prefix.
     */
    public static String normalizeUrl(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String normalized = url.trim().toLowerCase(Locale.ROOT);

        String fragment = "";
        int hash = normalized.indexOf('#');
        if (hash >= 0) {
            fragment = normalized.substring(hash);
            normalized = normalized.substring(0, hash);
        }

        int question = normalized.indexOf('?');
        if (question >= 0) {
            String base = normalized.substring(0, question);
            String query = stripTrackingParams(normalized.substring(question + 1));
            normalized = query.isEmpty() ? base : base + "?" + query;
        }

        normalized = normalized + fragment;
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }

        normalized = normalized.replace("://www.", "://");
        if (normalized.startsWith("www.")) {
            normalized = normalized.substring(4);
        }
        return normalized;
    }

    /**
     * Hex MD5 of the UTF-8 bytes.
     */
    public static String md5Hex(String value) {
        return DigestUtils.md5DigestAsHex(value.getBytes(StandardCharsets.UTF_8));
    }

    private static String stripTrackingParams(String query) {
        List<String> kept = new ArrayList<>();
        for (String param : query.split("&")) {
            if (param.isEmpty()) {
                continue;
            }
            String name = param.contains("=") ? param.substring(0, param.indexOf('=')) : param;
            if (TRACKING_PARAM_PREFIXES.stream().noneMatch(name::startsWith)) {
                kept.add(param);
            }
        }
        return String.join("&", kept);
    }
}
