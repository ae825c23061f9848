package com.purchasingpower.forge.agent;

import com.purchasingpower.forge.factstore.FactStore;
import com.purchasingpower.forge.model.conversation.ConversationState;

import java.util.List;

/**
 * What a tool sees of the running turn.
 */
public interface ToolContext {

    ConversationState getState();

    int getTurnNumber();

    default FactStore getFactStore() {
        return getState().getFactStore();
    }

    /**
     * Records a successful state change for the turn's mutation log.
     */
    void recordMutation(String description);

    List<String> getMutations();

    void markSummaryUpdated();

    boolean isSummaryUpdated();
}
