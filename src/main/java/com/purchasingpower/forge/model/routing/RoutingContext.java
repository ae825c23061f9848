package com.purchasingpower.forge.model.routing;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-conversation routing metadata.
 *
 * <p>{@code conversationSummary} is the only continuity channel into the next router call.
 * {@code summaryTurn} records the turn in which it was last written so a missing update can be
 * detected after the executor returns.
 */
@Data
public class RoutingContext {
    private String conversationSummary = "";
    private int summaryTurn;
    private List<GuidanceFiring> probesFired = new ArrayList<>();
    private List<GuidanceFiring> patternsFired = new ArrayList<>();
    private int turnCount;
    private boolean requiresRetrieval = true;
    private RoutingDecision lastDecision;
    private boolean microSynthesisDue;
    private boolean criticalMassReached;
    private int modeTurnCount;
}
