package com.leadharvest.scrape.util;

import com.leadharvest.scrape.model.FailureCategory;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Best-effort classification of pipeline failures by substring matching over
 * lower-cased error text. The same text always yields the same category.
 */
public final class FailureClassifier {
    private static final List<String> NETWORK_PATTERNS = List.of(
        "dns",
        "resolve",
        "getaddrinfo",
        "unknownhost",
        "name or service not known",
        "no such host",
        "connection refused",
        "connectexception",
        "err_name_not_resolved",
        "err_connection"
    );
    private static final List<String> TIMEOUT_PATTERNS = List.of("timeout", "timed out");
    private static final List<String> CONFIG_PATTERNS = List.of("selector", "css", "config");
    private static final int MAX_CAUSE_DEPTH = 8;

    private FailureClassifier() {}

    public static FailureCategory classify(Throwable error) {
        return classifyText(describe(error));
    }

    public static FailureCategory classifyText(String errorText) {
        if (errorText == null || errorText.isBlank()) {
            return FailureCategory.FATAL;
        }
        String lower = errorText.toLowerCase(Locale.ROOT);
        if (containsAny(lower, NETWORK_PATTERNS)) {
            return FailureCategory.NETWORK;
        }
        if (containsAny(lower, TIMEOUT_PATTERNS)) {
            return FailureCategory.TIMEOUT;
        }
        if (containsAny(lower, CONFIG_PATTERNS)) {
            return FailureCategory.CONFIG;
        }
        return FailureCategory.FATAL;
    }

    public static String describe(Throwable error) {
        if (error == null) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        Set<Throwable> seen = new HashSet<>();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < MAX_CAUSE_DEPTH && seen.add(current)) {
            if (out.length() > 0) {
                out.append(" | caused by ");
            }
            out.append(current.getClass().getSimpleName());
            if (current.getMessage() != null && !current.getMessage().isBlank()) {
                out.append(": ").append(current.getMessage().trim());
            }
            current = current.getCause();
            depth++;
        }
        return out.toString();
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
