package com.purchasingpower.forge.model.retrieval;

public record RetrievedTurn(
        int turnNumber,
        String activeProbe,
        String activeMode,
        String userMessage,
        String assistantResponse,
        double score
) {
}
