package com.purchasingpower.forge.model.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the router for one turn.
 *
 * <p>{@code nextProbe} is the active guidance key; it is resolved against the knowledge index,
 * never searched for.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RoutingDecision {

    private NextAction nextAction;
    private AnalysisMode enterMode;
    private String nextProbe;

    @Builder.Default
    private List<String> triggeredPatterns = new ArrayList<>();

    private boolean requiresRetrieval;

    @Builder.Default
    private List<String> conflictFlags = new ArrayList<>();

    @Builder.Default
    private List<String> highRiskUnprobed = new ArrayList<>();

    @Builder.Default
    private List<String> suggestedProbes = new ArrayList<>();

    private boolean microSynthesisDue;
    private boolean enrichmentNeeded;
    private String enrichmentQuery;
    private String problemDomain;
    private String reasoning;

    /**
     * True when this decision is the hardcoded default rather than router output.
     */
    private boolean fallback;

    public static RoutingDecision conservativeDefault(String reason) {
        return RoutingDecision.builder()
                .nextAction(NextAction.ASK_QUESTIONS)
                .requiresRetrieval(true)
                .reasoning(reason)
                .fallback(true)
                .build();
    }
}
