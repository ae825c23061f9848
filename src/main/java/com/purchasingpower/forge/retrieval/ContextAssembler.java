package com.purchasingpower.forge.retrieval;

import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.exception.EmbeddingException;
import com.purchasingpower.forge.knowledge.KnowledgeIndex;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.knowledge.GuidanceKind;
import com.purchasingpower.forge.model.knowledge.GuidanceUnit;
import com.purchasingpower.forge.model.retrieval.ContextBundle;
import com.purchasingpower.forge.model.retrieval.RetrievedDocument;
import com.purchasingpower.forge.model.retrieval.RetrievedTurn;
import com.purchasingpower.forge.model.routing.RoutingDecision;
import com.purchasingpower.forge.vector.VectorIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the executor's context for one turn.
 *
 * <p>Always-on tier: org and project context, the full assumption register, the skeleton, the
 * routing context and the last exchanges. When the router says no retrieval is needed only the
 * active guidance unit is added and the vector index is not touched. Otherwise triggered patterns,
 * document sections and older turns are added; embedding failures leave those sections empty.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextAssembler {

    private final KnowledgeIndex knowledgeIndex;
    private final VectorRetrievalService retrievalService;
    private final AppProperties appProperties;

    public ContextBundle assemble(String userMessage, RoutingDecision decision, int turnNumber,
                                  ConversationState state, VectorIndex vectorIndex) {
        GuidanceUnit activeGuidance = resolveActiveGuidance(decision.getNextProbe());

        ContextBundle.ContextBundleBuilder bundle = ContextBundle.builder()
                .orgContext(state.getOrgContext())
                .fileSummaries(List.copyOf(state.getProjectState().getFileSummaries()))
                .assumptions(state.getFactStore().all())
                .skeleton(state.getFactStore().getSkeleton())
                .routingContext(state.getRoutingContext())
                .recentExchanges(state.recentExchanges(appProperties.getRetrieval().getAlwaysOnWindow()))
                .activeGuidance(activeGuidance);

        if (!decision.isRequiresRetrieval()) {
            log.info("Turn {}: retrieval bypassed", turnNumber);
            return bundle.build();
        }

        bundle.triggeredPatterns(resolvePatterns(decision.getTriggeredPatterns()));

        String documentQuery = activeGuidance == null ? userMessage : userMessage + " " + activeGuidance.key();
        List<RetrievedDocument> documents = List.of();
        List<RetrievedTurn> turns = List.of();
        boolean degraded = false;
        try {
            documents = retrievalService.retrieveDocuments(vectorIndex, documentQuery, null);
        } catch (EmbeddingException e) {
            log.warn("Turn {}: document retrieval unavailable, continuing without it: {}", turnNumber, e.getMessage());
            degraded = true;
        }
        try {
            turns = retrievalService.retrieveConversations(vectorIndex, userMessage, turnNumber, null);
        } catch (EmbeddingException e) {
            log.warn("Turn {}: conversation retrieval unavailable, continuing without it: {}", turnNumber, e.getMessage());
            degraded = true;
        }
        log.info("Turn {}: retrieved {} document sections, {} older turns", turnNumber, documents.size(), turns.size());

        return bundle
                .documents(documents)
                .conversationTurns(turns)
                .retrievalPerformed(true)
                .retrievalDegraded(degraded)
                .build();
    }

    private GuidanceUnit resolveActiveGuidance(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        return knowledgeIndex.lookup(GuidanceKind.PROBE, key)
                .or(() -> knowledgeIndex.lookup(GuidanceKind.PATTERN, key))
                .orElseGet(() -> {
                    log.warn("Active guidance key '{}' not found in the knowledge index", key);
                    return null;
                });
    }

    private List<GuidanceUnit> resolvePatterns(List<String> keys) {
        List<GuidanceUnit> patterns = new ArrayList<>();
        for (String key : keys) {
            knowledgeIndex.lookup(GuidanceKind.PATTERN, key).ifPresent(patterns::add);
        }
        return patterns;
    }
}
