package com.architecture.diagram.irengine.service.codec;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps raw node and group ids to tokens every target language accepts: letters, digits and
 * underscores, starting with a letter.
 *
 * One instance covers one encoding run. The same raw id always maps to the same token, and two
 * raw ids that sanitize to the same text get {@code _2}, {@code _3}, ... suffixes instead of
 * silently merging.
 */
public class IdentifierSanitizer {

    static final String EMPTY_ID = "node";

    private final Map<String, String> assigned = new HashMap<>();
    private final Set<String> taken = new HashSet<>();

    public String idFor(String rawId) {
        return idFor("", rawId);
    }

    /**
     * Token for {@code rawId} within {@code namespace}. Namespaces keep a group and a node that
     * share a raw id apart while still drawing from one pool of tokens.
     */
    public String idFor(String namespace, String rawId) {
        String key = namespace + '\u0000' + (rawId == null ? "" : rawId);
        String existing = assigned.get(key);
        if (existing != null) {
            return existing;
        }
        String base = sanitize(rawId);
        String candidate = base;
        int suffix = 2;
        while (taken.contains(candidate)) {
            candidate = base + "_" + suffix++;
        }
        taken.add(candidate);
        assigned.put(key, candidate);
        return candidate;
    }

    public Optional<String> lookup(String rawId) {
        return Optional.ofNullable(assigned.get('\u0000' + (rawId == null ? "" : rawId)));
    }

    public static String sanitize(String value) {
        if (value == null || value.isBlank()) {
            return EMPTY_ID;
        }
        String trimmed = value.trim();
        StringBuilder sb = new StringBuilder(trimmed.length() + 2);
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            sb.append(isAsciiLetterOrDigit(c) || c == '_' ? c : '_');
        }
        if (!isAsciiLetter(sb.charAt(0))) {
            sb.insert(0, "n_");
        }
        return sb.toString();
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAsciiLetterOrDigit(char c) {
        return isAsciiLetter(c) || (c >= '0' && c <= '9');
    }
}
