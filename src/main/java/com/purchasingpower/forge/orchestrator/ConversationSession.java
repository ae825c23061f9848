package com.purchasingpower.forge.orchestrator;

import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.vector.VectorIndex;
import lombok.Getter;

import java.util.concurrent.locks.ReentrantLock;

/**
 * One live conversation: its state, its vector index and the lock that serialises its turns.
 * A message arriving while a turn is in flight waits for that turn to finish.
 */
@Getter
public class ConversationSession {

    private final String conversationId;
    private final VectorIndex vectorIndex;
    private final ReentrantLock lock = new ReentrantLock(true);
    private volatile ConversationState state;

    public ConversationSession(ConversationState state, VectorIndex vectorIndex) {
        this.conversationId = state.getConversationId();
        this.state = state;
        this.vectorIndex = vectorIndex;
    }

    /**
     * Swaps in restored state. Callers hold the lock.
     */
    void replaceState(ConversationState restored) {
        this.state = restored;
    }
}
