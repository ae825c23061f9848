package com.purchasingpower.forge.agent.impl;

import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.model.conversation.ConversationState;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class ToolContextImpl implements ToolContext {

    private ConversationState state;

    private int turnNumber;

    @Builder.Default
    private List<String> mutations = new ArrayList<>();

    private boolean summaryUpdated;

    @Override
    public void recordMutation(String description) {
        mutations.add(description);
    }

    @Override
    public void markSummaryUpdated() {
        summaryUpdated = true;
    }

    public static ToolContextImpl create(ConversationState state) {
        return ToolContextImpl.builder()
                .state(state)
                .turnNumber(state.getCurrentTurn())
                .build();
    }
}
