package com.realtycrm.mlssync.service.provider;

import java.util.Collections;
import java.util.Map;

/**
 * One listing as the provider delivered it: a tree of maps, lists and scalar values.
 */
public record ProviderRecord(Map<String, Object> fields) {

    public ProviderRecord {
        fields = fields == null ? Collections.emptyMap() : Collections.unmodifiableMap(fields);
    }

    /**
     * Resolves a dotted path such as {@code Address.City}. An exact key match is tried first, so provider
     * field names that themselves contain dots still resolve.
     *
     * @return the value, or {@code null} when any segment is missing or not an object.
     */
    public Object valueAt(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        if (fields.containsKey(path)) {
            return fields.get(path);
        }
        Object current = fields;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }
}
