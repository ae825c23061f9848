package com.purchasingpower.forge.orchestrator;

import com.purchasingpower.forge.model.routing.RoutingDecision;

import java.util.List;

/**
 * What a caller sees after one turn.
 *
 * @param artifact rendered document produced this turn, or null
 * @param degraded true when the executor could not finish normally and returned a fallback text
 */
public record TurnOutcome(String conversationId, int turnNumber, String response, RoutingDecision decision,
                          List<String> mutationsApplied, String artifact, boolean degraded) {
}
