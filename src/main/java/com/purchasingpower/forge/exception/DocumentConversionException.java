package com.purchasingpower.forge.exception;

import lombok.Getter;

/**
 * Raised when an uploaded document cannot be turned into markdown.
 *
 * <p>The caller keeps the raw bytes; only ingestion of this one document is skipped.
 */
@Getter
public class DocumentConversionException extends RuntimeException {

    private final String sourceId;

    private final boolean unsupportedFormat;

    public DocumentConversionException(String sourceId, String message, boolean unsupportedFormat) {
        super(message);
        this.sourceId = sourceId;
        this.unsupportedFormat = unsupportedFormat;
    }

    public DocumentConversionException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
        this.unsupportedFormat = false;
    }
}
