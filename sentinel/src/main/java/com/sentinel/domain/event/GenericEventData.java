package com.sentinel.domain.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Untyped event payload for producers without a typed variant.
 */
public record GenericEventData(Map<String, Object> fields) implements EventData {

    public GenericEventData {
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static GenericEventData of(Map<String, Object> fields) {
        return new GenericEventData(fields);
    }

    public static GenericEventData empty() {
        return new GenericEventData(Map.of());
    }

    public Object get(String key) {
        return fields.get(key);
    }
}
