package com.purchasingpower.forge.model.retrieval;

import com.purchasingpower.forge.model.assumption.Assumption;
import com.purchasingpower.forge.model.conversation.ChatMessage;
import com.purchasingpower.forge.model.conversation.FileSummary;
import com.purchasingpower.forge.model.conversation.OrgContext;
import com.purchasingpower.forge.model.knowledge.GuidanceUnit;
import com.purchasingpower.forge.model.routing.RoutingContext;
import com.purchasingpower.forge.model.skeleton.FindingSkeleton;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the executor sees for one turn, kept as typed sections until the prompt is rendered.
 *
 * <p>The always-on sections are always filled. {@code activeGuidance} may be null.
 * {@code documents} and {@code conversationTurns} are empty when retrieval was bypassed or failed.
 */
@Value
@Builder
public class ContextBundle {

    OrgContext orgContext;

    @Builder.Default
    List<FileSummary> fileSummaries = List.of();

    @Builder.Default
    List<Assumption> assumptions = List.of();

    FindingSkeleton skeleton;
    RoutingContext routingContext;

    @Builder.Default
    List<ChatMessage> recentExchanges = List.of();

    GuidanceUnit activeGuidance;

    @Builder.Default
    List<GuidanceUnit> triggeredPatterns = List.of();

    @Builder.Default
    List<RetrievedDocument> documents = List.of();

    @Builder.Default
    List<RetrievedTurn> conversationTurns = List.of();

    /**
     * True when the vector index was consulted this turn.
     */
    boolean retrievalPerformed;

    /**
     * True when retrieval was attempted but failed and the bundle fell back to always-on context.
     */
    boolean retrievalDegraded;
}
