package com.purchasingpower.forge.model;

/**
 * Enumeration of external service types for unified logging.
 *
 * @see com.purchasingpower.forge.util.ExternalCallLogger
 */
public enum ServiceType {
    GEMINI("🔴", "Gemini"),
    VECTOR_STORE("🔵", "VectorStore"),
    DOCUMENT("📄", "Document");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
