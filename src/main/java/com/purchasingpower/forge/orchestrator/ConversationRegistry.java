package com.purchasingpower.forge.orchestrator;

import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.exception.ConversationNotFoundException;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.vector.VectorIndexFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Live sessions by conversation id. A conversation that is not in memory is reloaded from its
 * saved snapshot on first access.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationRegistry {

    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();

    private final VectorIndexFactory vectorIndexFactory;
    private final SnapshotStore snapshotStore;
    private final AppProperties appProperties;

    public ConversationSession create() {
        String conversationId = UUID.randomUUID().toString();
        ConversationSession session = open(new ConversationState(conversationId,
                appProperties.getConversation().getCascadeDepth()));
        sessions.put(conversationId, session);
        log.info("Created conversation {}", conversationId);
        return session;
    }

    public Optional<ConversationSession> find(String conversationId) {
        if (conversationId == null || !VALID_ID.matcher(conversationId).matches()) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.computeIfAbsent(conversationId, this::reload));
    }

    public ConversationSession require(String conversationId) {
        return find(conversationId).orElseThrow(() -> new ConversationNotFoundException(conversationId));
    }

    /**
     * The existing session, or a fresh one holding default state for an unknown id.
     *
     * @throws ConversationNotFoundException if the id is not usable as a directory name
     */
    public ConversationSession findOrCreate(String conversationId) {
        if (conversationId == null || !VALID_ID.matcher(conversationId).matches()) {
            throw new ConversationNotFoundException(conversationId);
        }
        return sessions.computeIfAbsent(conversationId, id -> {
            ConversationSession reloaded = reload(id);
            return reloaded != null ? reloaded
                    : open(new ConversationState(id, appProperties.getConversation().getCascadeDepth()));
        });
    }

    private ConversationSession reload(String conversationId) {
        return snapshotStore.load(conversationId)
                .map(snapshot -> open(snapshotStore.restore(conversationId, snapshot)))
                .orElse(null);
    }

    private ConversationSession open(ConversationState state) {
        return new ConversationSession(state, vectorIndexFactory.open(state.getConversationId()));
    }
}
