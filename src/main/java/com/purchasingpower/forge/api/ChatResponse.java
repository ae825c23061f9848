package com.purchasingpower.forge.api;

import com.purchasingpower.forge.orchestrator.TurnOutcome;
import com.purchasingpower.forge.util.WireNames;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response from the message endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private boolean success;
    private String conversationId;
    private int turnNumber;
    private String response;

    /**
     * Rendered document produced this turn, also contained in {@code response}.
     */
    private String artifact;

    private String nextAction;
    private String activeProbe;
    private boolean degraded;

    @Builder.Default
    private List<String> mutations = new ArrayList<>();

    public static ChatResponse from(TurnOutcome outcome) {
        return ChatResponse.builder()
                .success(true)
                .conversationId(outcome.conversationId())
                .turnNumber(outcome.turnNumber())
                .response(outcome.response())
                .artifact(outcome.artifact())
                .nextAction(WireNames.of(outcome.decision().getNextAction()))
                .activeProbe(outcome.decision().getNextProbe())
                .degraded(outcome.degraded())
                .mutations(new ArrayList<>(outcome.mutationsApplied()))
                .build();
    }
}
