package com.purchasingpower.forge.model.conversation;

import com.purchasingpower.forge.factstore.FactStore;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import com.purchasingpower.forge.model.routing.ConversationPhase;
import com.purchasingpower.forge.model.routing.RoutingContext;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * All mutable state of one conversation. Owned by its session and only touched under the
 * session lock.
 */
@Getter
@Setter
public class ConversationState {

    private final String conversationId;
    private List<ChatMessage> messages = new ArrayList<>();
    private ConversationPhase phase = ConversationPhase.GATHERING;
    private AnalysisMode activeMode;
    private FactStore factStore;
    private RoutingContext routingContext = new RoutingContext();
    private OrgContext orgContext = new OrgContext();
    private ProjectState projectState = new ProjectState();
    private String latestArtifact;

    public ConversationState(String conversationId, int cascadeDepth) {
        this.conversationId = conversationId;
        this.factStore = new FactStore(cascadeDepth);
    }

    public int getCurrentTurn() {
        return routingContext.getTurnCount();
    }

    /**
     * The last {@code exchanges} user/assistant pairs, oldest first.
     */
    public List<ChatMessage> recentExchanges(int exchanges) {
        int from = Math.max(0, messages.size() - exchanges * 2);
        return List.copyOf(messages.subList(from, messages.size()));
    }
}
