package com.purchasingpower.forge.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class RetrievalProperties {

    /**
     * Most recent turns always sent verbatim; older turns are only reachable through retrieval.
     */
    @Min(1)
    private int alwaysOnWindow = 3;

    @Min(1)
    private int maxDocumentResults = 4;

    @Min(1)
    private int maxConversationResults = 3;

    /**
     * When false, vector collections live only in memory for the lifetime of the process.
     */
    private boolean persistVectors = true;
}
