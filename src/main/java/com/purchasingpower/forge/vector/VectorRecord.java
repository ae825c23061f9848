package com.purchasingpower.forge.vector;

import java.util.Map;

/**
 * One stored entry. {@code text} is what was embedded; {@code metadata} values are strings or integers.
 */
public record VectorRecord(String id, float[] vector, String text, Map<String, Object> metadata) {
}
