package com.purchasingpower.forge.orchestrator;

/**
 * Outcome of ingesting one document. On failure the raw file is still on disk.
 */
public record IngestionResult(String sourceId, boolean success, int chunkCount, String summary,
                              ErrorType errorType, String errorMessage) {

    public enum ErrorType {
        UNSUPPORTED_FORMAT,
        CONVERSION_FAILED,
        EMBEDDING_FAILED
    }

    public static IngestionResult success(String sourceId, int chunkCount, String summary) {
        return new IngestionResult(sourceId, true, chunkCount, summary, null, null);
    }

    public static IngestionResult failure(String sourceId, ErrorType errorType, String errorMessage) {
        return new IngestionResult(sourceId, false, 0, null, errorType, errorMessage);
    }
}
