package com.cranestats.model;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Raw tag code to human-readable metric name. Keys and values are stored cleaned.
 * Lookups are total: an unmapped code resolves to its cleaned self.
 */
public final class TagMapping {

    private static final Pattern NON_PRINTABLE = Pattern.compile("[^\\x20-\\x7E]");

    private final Map<String, String> names;

    public TagMapping(Map<String, String> rawToName) {
        Map<String, String> cleaned = new HashMap<>();
        rawToName.forEach((raw, name) -> {
            String key = clean(raw);
            String value = clean(name);
            if (!key.isEmpty() && !value.isEmpty()) {
                cleaned.put(key, value);
            }
        });
        this.names = Map.copyOf(cleaned);
    }

    public static TagMapping empty() {
        return new TagMapping(Map.of());
    }

    /**
     * Removes characters outside printable ASCII and trims surrounding whitespace.
     */
    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        return NON_PRINTABLE.matcher(raw.strip()).replaceAll("").strip();
    }

    public String resolve(String rawTag) {
        String key = clean(rawTag);
        return names.getOrDefault(key, key);
    }

    public boolean contains(String rawTag) {
        return names.containsKey(clean(rawTag));
    }

    public int size() {
        return names.size();
    }
}
