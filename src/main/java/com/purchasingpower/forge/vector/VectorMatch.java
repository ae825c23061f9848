package com.purchasingpower.forge.vector;

import java.util.Map;

/**
 * @param score cosine similarity, higher is closer
 */
public record VectorMatch(String id, double score, String text, Map<String, Object> metadata) {

    public String stringValue(String key) {
        Object value = metadata.get(key);
        return value == null ? "" : value.toString();
    }

    public int intValue(String key) {
        Object value = metadata.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return value == null ? 0 : Integer.parseInt(value.toString());
    }
}
