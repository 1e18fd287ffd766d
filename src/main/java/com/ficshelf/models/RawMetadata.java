package com.ficshelf.models;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata for one story exactly as the retrieval tool wrote it. Read-only;
 * converters build a {@link CanonicalMetadata} from it instead of editing it.
 */
public final class RawMetadata {

    private final Map<String, Object> fields;

    public RawMetadata(Map<String, ?> fields) {
        this.fields = fields != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(fields))
            : Collections.emptyMap();
    }

    public static RawMetadata empty() {
        return new RawMetadata(null);
    }

    public boolean has(String key) {
        return fields.containsKey(key) && fields.get(key) != null;
    }

    public Object get(String key) {
        return fields.get(key);
    }

    /**
     * Whether the value under {@code key} is absent or a plain string/number/boolean.
     */
    public boolean isScalarOrAbsent(String key) {
        Object value = fields.get(key);
        return value == null || !(value instanceof Map || value instanceof Collection || value.getClass().isArray());
    }

    /**
     * String form of a scalar value; null when absent or not a scalar.
     */
    public String getString(String key) {
        Object value = fields.get(key);
        if (value == null || !isScalarOrAbsent(key)) {
            return null;
        }
        return value.toString();
    }

    public String getString(String key, String defaultValue) {
        String value = getString(key);
        return value != null ? value : defaultValue;
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public String toString() {
        return "RawMetadata" + fields.keySet();
    }
}
