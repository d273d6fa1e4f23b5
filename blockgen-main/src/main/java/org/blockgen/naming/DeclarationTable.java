package org.blockgen.naming;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Top-of-program declarations collected during one pass, keyed by category and kept in insertion
 * order.
 */
public final class DeclarationTable {

    public static final String VARIABLES = "variables";

    private final Map<String, String> entries = new LinkedHashMap<>();

    public void put(String key, String code) {
        entries.put(key, code);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public String get(String key) {
        return entries.get(key);
    }

    public Collection<String> values() {
        return entries.values();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * All declarations separated by a blank line.
     */
    public String render() {
        return String.join("\n\n", entries.values());
    }

    public void clear() {
        entries.clear();
    }
}
