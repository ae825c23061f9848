package com.purchasingpower.forge.routing;

import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.conversation.OrgContext;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import com.purchasingpower.forge.model.routing.ConversationPhase;
import com.purchasingpower.forge.model.routing.NextAction;
import com.purchasingpower.forge.model.routing.RoutingContext;
import com.purchasingpower.forge.model.routing.RoutingDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Gathering ↔ ModeActive(mode) transitions and the per-turn routing bookkeeping.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationStateMachine {

    private final AppProperties appProperties;

    /**
     * Applies a router decision before the executor runs: mode entry, the complete_mode safety
     * net and the enrichment gate. Returns the decision the rest of the turn should use.
     */
    public RoutingDecision applyDecision(ConversationState state, RoutingDecision decision) {
        AnalysisMode requested = decision.getEnterMode();
        if (requested != null && state.getActiveMode() != requested) {
            enter(state, requested);
        }

        if (decision.getNextAction() == NextAction.COMPLETE_MODE && state.getActiveMode() != null) {
            log.info("Router flagged {} as complete, returning to gathering", state.getActiveMode());
            complete(state);
        }

        RoutingDecision gated = gateEnrichment(decision, state.getOrgContext());
        state.getRoutingContext().setLastDecision(gated);
        state.getRoutingContext().setRequiresRetrieval(gated.isRequiresRetrieval());
        return gated;
    }

    public void enter(ConversationState state, AnalysisMode mode) {
        RoutingContext routing = state.getRoutingContext();
        state.setPhase(ConversationPhase.MODE_ACTIVE);
        state.setActiveMode(mode);
        routing.setModeTurnCount(0);
        if (mode == AnalysisMode.MODE_1) {
            routing.setCriticalMassReached(true);
        }
        log.info("Entered {} ({})", mode, mode.getDisplayName());
    }

    /**
     * Back to gathering. Finishing solution evaluation clears its working fields; the problem
     * framing, assumptions and guidance history stay.
     */
    public void complete(ConversationState state) {
        if (state.getActiveMode() == AnalysisMode.MODE_2) {
            state.getFactStore().clearSolutionEvaluation();
        }
        state.setPhase(ConversationPhase.GATHERING);
        state.setActiveMode(null);
        state.getRoutingContext().setModeTurnCount(0);
    }

    /**
     * Runs after the executor: micro-synthesis cadence and mode turn counting.
     */
    public void afterTurn(ConversationState state) {
        RoutingContext routing = state.getRoutingContext();
        int interval = appProperties.getConversation().getMicroSynthesisInterval();
        routing.setMicroSynthesisDue(state.getCurrentTurn() % interval == 0);
        if (state.getActiveMode() != null) {
            routing.setModeTurnCount(routing.getModeTurnCount() + 1);
        }
    }

    /**
     * The router's domain-shift judgment only stands while enrichments remain and the domain it
     * names differs from the last enriched one. Without a named domain the flag is trusted.
     */
    RoutingDecision gateEnrichment(RoutingDecision decision, OrgContext org) {
        if (!decision.isEnrichmentNeeded()) {
            return decision;
        }
        int max = appProperties.getConversation().getMaxEnrichments();
        boolean underCap = org.getEnrichmentCount() < max;
        String domain = normalizeDomain(decision.getProblemDomain());
        boolean shifted = domain.isEmpty() || !domain.equals(normalizeDomain(org.getLastEnrichedDomain()));

        if (underCap && shifted) {
            return decision;
        }
        log.info("Enrichment suppressed (count {}/{}, domain '{}' vs last '{}')",
                org.getEnrichmentCount(), max, decision.getProblemDomain(), org.getLastEnrichedDomain());
        return decision.toBuilder().enrichmentNeeded(false).enrichmentQuery(null).build();
    }

    private static String normalizeDomain(String domain) {
        return domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
