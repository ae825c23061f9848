package com.purchasingpower.forge.chunking;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum DocumentFormat {
    MARKDOWN(Set.of("md", "markdown", "text/markdown")),
    TEXT(Set.of("txt", "text", "text/plain")),
    DOCX(Set.of("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"));

    private final Set<String> aliases;

    DocumentFormat(Set<String> aliases) {
        this.aliases = aliases;
    }

    /**
     * Resolve a declared format (extension or MIME type), falling back to the file extension.
     */
    public static Optional<DocumentFormat> resolve(String declared, String filename) {
        Optional<DocumentFormat> fromDeclared = byAlias(declared);
        return fromDeclared.isPresent() ? fromDeclared : fromFilename(filename);
    }

    public static Optional<DocumentFormat> fromFilename(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? Optional.empty() : byAlias(filename.substring(dot + 1));
    }

    private static Optional<DocumentFormat> byAlias(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (DocumentFormat format : values()) {
            if (format.aliases.contains(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
