package com.purchasingpower.forge.model.retrieval;

import lombok.Builder;
import lombok.Value;

/**
 * A completed turn as indexed into the conversations collection. The summary is what gets
 * embedded; the full exchange rides along as payload.
 */
@Value
@Builder
public class TurnRecord {
    int turnNumber;
    String summary;
    String userMessage;
    String assistantResponse;
    String activeProbe;
    String activeMode;

    public String id() {
        return "turn_" + turnNumber;
    }
}
