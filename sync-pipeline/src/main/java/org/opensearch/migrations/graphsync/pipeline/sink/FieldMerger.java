package org.opensearch.migrations.graphsync.pipeline.sink;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges a partial document into a stored one the way the document store does for partial updates:
 * incoming fields win, stored fields missing from the update are kept, and objects present on both sides
 * are merged key by key.
 */
public final class FieldMerger {

    private FieldMerger() {}

    public static Map<String, Object> merge(Map<String, Object> stored, Map<String, Object> incoming) {
        var merged = new LinkedHashMap<String, Object>(stored);
        // Null is a value here: an incoming null overwrites the stored field
        incoming.forEach((field, value) -> merged.put(field, mergeValue(merged.get(field), value)));
        return merged;
    }

    @SuppressWarnings("unchecked")
    private static Object mergeValue(Object storedValue, Object incomingValue) {
        if (storedValue instanceof Map && incomingValue instanceof Map) {
            return merge((Map<String, Object>) storedValue, (Map<String, Object>) incomingValue);
        }
        return incomingValue;
    }
}
