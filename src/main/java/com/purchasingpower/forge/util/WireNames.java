package com.purchasingpower.forge.util;

import java.util.Locale;

/**
 * Lower-case snake names used for enums in prompts and tool schemas.
 */
public final class WireNames {

    private WireNames() {
    }

    public static String of(Enum<?> value) {
        return value == null ? "none" : value.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient reverse lookup: case-insensitive, dashes and spaces treated as underscores.
     *
     * @return the matching constant or null
     */
    public static <E extends Enum<E>> E parse(Class<E> type, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return constant;
            }
        }
        return null;
    }
}
