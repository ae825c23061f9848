package com.purchasingpower.forge.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.exception.StorageUnavailableException;
import com.purchasingpower.forge.factstore.FactStore;
import com.purchasingpower.forge.model.CallContext;
import com.purchasingpower.forge.model.ServiceType;
import com.purchasingpower.forge.model.conversation.ConversationSnapshot;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.util.ExternalCallLogger;
import com.purchasingpower.forge.workspace.WorkspaceLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Converts conversation state to and from {@link ConversationSnapshot} and keeps the latest one
 * on disk as {@code snapshot.json}.
 *
 * <p>Restore overlays saved values on a fresh state: absent keys keep their defaults, including
 * keys missing inside the routing context, org context and skeleton.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotStore {

    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final WorkspaceLayout workspaceLayout;

    /**
     * Deep copy of the state, detached from the live objects.
     */
    public ConversationSnapshot capture(ConversationState state) {
        ConversationSnapshot snapshot = new ConversationSnapshot();
        snapshot.setConversationId(state.getConversationId());
        snapshot.setSavedAt(Instant.now().toString());
        snapshot.setMessages(new ArrayList<>(state.getMessages()));
        snapshot.setPhase(state.getPhase());
        snapshot.setActiveMode(state.getActiveMode());
        snapshot.setFactStore(state.getFactStore().snapshot());
        snapshot.setRoutingContext(state.getRoutingContext());
        snapshot.setOrgContext(state.getOrgContext());
        snapshot.setProjectState(state.getProjectState());
        snapshot.setLatestArtifact(state.getLatestArtifact());
        return objectMapper.convertValue(snapshot, ConversationSnapshot.class);
    }

    public ConversationState restore(String conversationId, ConversationSnapshot snapshot) {
        if (!ConversationSnapshot.SCHEMA_VERSION.equals(snapshot.getSchemaVersion())) {
            log.warn("Snapshot schema version mismatch for {}: saved={}, current={}. Loading anyway.",
                    conversationId, snapshot.getSchemaVersion(), ConversationSnapshot.SCHEMA_VERSION);
        }
        if (snapshot.getConversationId() != null && !snapshot.getConversationId().equals(conversationId)) {
            log.warn("Snapshot was saved for {} but is restored into {}", snapshot.getConversationId(), conversationId);
        }
        ConversationSnapshot copy = objectMapper.convertValue(snapshot, ConversationSnapshot.class);
        int cascadeDepth = appProperties.getConversation().getCascadeDepth();

        ConversationState state = new ConversationState(conversationId, cascadeDepth);
        if (copy.getMessages() != null) {
            state.setMessages(new ArrayList<>(copy.getMessages()));
        }
        if (copy.getPhase() != null) {
            state.setPhase(copy.getPhase());
        }
        state.setActiveMode(copy.getActiveMode());
        state.setFactStore(FactStore.restore(copy.getFactStore(), cascadeDepth));
        if (copy.getRoutingContext() != null) {
            state.setRoutingContext(copy.getRoutingContext());
        }
        if (copy.getOrgContext() != null) {
            state.setOrgContext(copy.getOrgContext());
        }
        if (copy.getProjectState() != null) {
            state.setProjectState(copy.getProjectState());
        }
        state.setLatestArtifact(copy.getLatestArtifact());
        log.info("Restored conversation {} at turn {} ({} assumptions)",
                conversationId, state.getCurrentTurn(), state.getFactStore().all().size());
        return state;
    }

    /**
     * Writes through a temporary file so a crash never leaves a half-written snapshot.
     */
    public void save(ConversationSnapshot snapshot) {
        if (!appProperties.getConversation().isPersistSnapshots()) {
            return;
        }
        Path target = workspaceLayout.snapshotFile(snapshot.getConversationId());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved snapshot for {}", snapshot.getConversationId());
        } catch (IOException e) {
            log.error("Failed to save snapshot to {}", target, e);
            throw new StorageUnavailableException(target.toString(), e);
        }
    }

    public Optional<ConversationSnapshot> load(String conversationId) {
        if (!appProperties.getConversation().isPersistSnapshots()) {
            return Optional.empty();
        }
        Path file = workspaceLayout.snapshotFile(conversationId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.DOCUMENT, "load-snapshot", log);
        try {
            ConversationSnapshot snapshot = objectMapper.readValue(file.toFile(), ConversationSnapshot.class);
            ctx.logResponse("Loaded snapshot of " + conversationId);
            return Optional.of(snapshot);
        } catch (IOException e) {
            ctx.logError("Cannot read " + file, e);
            throw new StorageUnavailableException(file.toString(), e);
        }
    }
}
