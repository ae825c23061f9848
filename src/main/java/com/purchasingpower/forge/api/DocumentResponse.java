package com.purchasingpower.forge.api;

import com.purchasingpower.forge.orchestrator.IngestionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a document upload or removal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

    private boolean success;
    private String sourceId;
    private int chunkCount;
    private String summary;
    private String errorType;
    private String error;

    public static DocumentResponse from(IngestionResult result) {
        return DocumentResponse.builder()
                .success(result.success())
                .sourceId(result.sourceId())
                .chunkCount(result.chunkCount())
                .summary(result.summary())
                .errorType(result.errorType() == null ? null : result.errorType().name())
                .error(result.errorMessage())
                .build();
    }

    public static DocumentResponse removed(String sourceId, int chunksRemoved) {
        return DocumentResponse.builder()
                .success(true)
                .sourceId(sourceId)
                .chunkCount(chunksRemoved)
                .build();
    }
}
