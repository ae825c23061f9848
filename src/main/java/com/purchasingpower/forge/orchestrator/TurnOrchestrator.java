package com.purchasingpower.forge.orchestrator;

import com.purchasingpower.forge.agent.ExecutionResult;
import com.purchasingpower.forge.agent.TurnExecutor;
import com.purchasingpower.forge.chunking.ChunkingPipeline;
import com.purchasingpower.forge.chunking.DocumentFormat;
import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.exception.DocumentConversionException;
import com.purchasingpower.forge.exception.EmbeddingException;
import com.purchasingpower.forge.exception.StorageUnavailableException;
import com.purchasingpower.forge.model.conversation.ChatMessage;
import com.purchasingpower.forge.model.conversation.ConversationSnapshot;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.conversation.FileSummary;
import com.purchasingpower.forge.model.retrieval.ContextBundle;
import com.purchasingpower.forge.model.retrieval.TurnRecord;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import com.purchasingpower.forge.model.routing.RoutingContext;
import com.purchasingpower.forge.model.routing.RoutingDecision;
import com.purchasingpower.forge.retrieval.ContextAssembler;
import com.purchasingpower.forge.retrieval.VectorRetrievalService;
import com.purchasingpower.forge.routing.ConversationStateMachine;
import com.purchasingpower.forge.routing.TurnRouter;
import com.purchasingpower.forge.util.WireNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs turns and document ingestion for one conversation at a time.
 *
 * <p>Each turn: storage check, router, state machine, context assembly, executor, then post-turn
 * bookkeeping (cadence flags, rolling summary guard, turn indexing, snapshot). Only a storage
 * failure detected before the turn starts reaches the caller; every later failure is absorbed
 * where it happens.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnOrchestrator {

    private final ConversationRegistry registry;
    private final TurnRouter router;
    private final ConversationStateMachine stateMachine;
    private final ContextAssembler assembler;
    private final TurnExecutor executor;
    private final VectorRetrievalService retrievalService;
    private final ChunkingPipeline chunkingPipeline;
    private final SummaryService summaryService;
    private final SnapshotStore snapshotStore;
    private final RawDocumentStore rawDocumentStore;
    private final AppProperties appProperties;

    public String createConversation() {
        ConversationSession session = registry.create();
        persist(session.getState());
        return session.getConversationId();
    }

    /**
     * @throws StorageUnavailableException if the conversation's storage cannot be written; nothing
     *         about the conversation has changed in that case
     * @throws com.purchasingpower.forge.exception.ConversationNotFoundException for an unknown id
     */
    public TurnOutcome handleMessage(String conversationId, String userMessage) {
        ConversationSession session = registry.require(conversationId);
        session.getLock().lock();
        try {
            session.getVectorIndex().ensureAvailable();
            ConversationState state = session.getState();
            RoutingContext routing = state.getRoutingContext();

            routing.setTurnCount(routing.getTurnCount() + 1);
            int turn = state.getCurrentTurn();
            log.info("Turn {} of {} started", turn, conversationId);

            RoutingDecision decision = stateMachine.applyDecision(state, router.route(userMessage, state));
            AnalysisMode turnMode = state.getActiveMode();
            ContextBundle bundle = assembler.assemble(userMessage, decision, turn, state, session.getVectorIndex());
            ExecutionResult result = executor.execute(userMessage, decision, bundle, state);

            state.getMessages().add(ChatMessage.user(userMessage));
            state.getMessages().add(ChatMessage.assistant(result.responseText()));

            afterTurn(session, turn, userMessage, result, decision, turnMode);

            log.info("Turn {} of {} finished: {} mutations, {} iterations{}", turn, conversationId,
                    result.mutationsApplied().size(), result.iterations(), result.failed() ? " (degraded)" : "");
            return new TurnOutcome(conversationId, turn, result.responseText(), decision,
                    result.mutationsApplied(), result.artifact(), result.failed());
        } finally {
            session.getLock().unlock();
        }
    }

    private void afterTurn(ConversationSession session, int turn, String userMessage, ExecutionResult result,
                           RoutingDecision decision, AnalysisMode turnMode) {
        ConversationState state = session.getState();
        stateMachine.afterTurn(state);

        if (!result.summaryUpdated()) {
            log.warn("Turn {} ended without a conversation summary update, synthesising one", turn);
            state.getRoutingContext().setConversationSummary(summaryService.synthesizeRollingSummary(state));
            state.getRoutingContext().setSummaryTurn(turn);
        }

        if (turn > appProperties.getRetrieval().getAlwaysOnWindow()) {
            indexTurn(session, turn, userMessage, result.responseText(), decision, turnMode);
        }

        try {
            persist(state);
        } catch (StorageUnavailableException e) {
            log.error("Turn {} completed but its snapshot could not be saved: {}", turn, e.getMessage());
        }
    }

    private void indexTurn(ConversationSession session, int turn, String userMessage, String response,
                           RoutingDecision decision, AnalysisMode turnMode) {
        try {
            String summary = summaryService.summarizeTurn(turn, userMessage, response);
            retrievalService.indexTurn(session.getVectorIndex(), TurnRecord.builder()
                    .turnNumber(turn)
                    .summary(summary)
                    .userMessage(userMessage)
                    .assistantResponse(response)
                    .activeProbe(decision.getNextProbe())
                    .activeMode(turnMode == null ? null : WireNames.of(turnMode))
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to index turn {}: {}", turn, e.getMessage());
        }
    }

    // ---------------------------------------------------------------- persistence

    public ConversationSnapshot snapshot(String conversationId) {
        ConversationSession session = registry.require(conversationId);
        session.getLock().lock();
        try {
            return snapshotStore.capture(session.getState());
        } finally {
            session.getLock().unlock();
        }
    }

    /**
     * Replaces the conversation's state with the snapshot, creating the conversation if needed.
     */
    public void restore(String conversationId, ConversationSnapshot snapshot) {
        ConversationSession session = registry.findOrCreate(conversationId);
        session.getLock().lock();
        try {
            ConversationState restored = snapshotStore.restore(conversationId, snapshot);
            session.replaceState(restored);
            persist(restored);
        } finally {
            session.getLock().unlock();
        }
    }

    private void persist(ConversationState state) {
        snapshotStore.save(snapshotStore.capture(state));
    }

    // ---------------------------------------------------------------- documents

    /**
     * Stores the raw bytes, then converts, chunks and indexes them. Re-ingesting a source replaces
     * its chunks. Conversion and embedding failures are reported in the result and leave the raw
     * file and every other document untouched.
     *
     * @param declaredFormat extension or MIME type; the source id's extension is used when absent
     * @param suppliedSummary used as the file summary when present, otherwise one is generated
     */
    public IngestionResult ingestDocument(String conversationId, String sourceId, byte[] content,
                                          String declaredFormat, String suppliedSummary) {
        ConversationSession session = registry.require(conversationId);
        session.getLock().lock();
        try {
            session.getVectorIndex().ensureAvailable();
            rawDocumentStore.store(conversationId, sourceId, content);

            Optional<DocumentFormat> format = DocumentFormat.resolve(declaredFormat, sourceId);
            if (format.isEmpty()) {
                log.warn("Unsupported document format for {} (declared '{}')", sourceId, declaredFormat);
                return IngestionResult.failure(sourceId, IngestionResult.ErrorType.UNSUPPORTED_FORMAT,
                        "Unsupported file type: " + sourceId);
            }

            ChunkingPipeline.ChunkedDocument document;
            try {
                document = chunkingPipeline.process(sourceId, content, format.get());
            } catch (DocumentConversionException e) {
                log.error("Conversion failed for {}: {}", sourceId, e.getMessage());
                return IngestionResult.failure(sourceId, e.isUnsupportedFormat()
                        ? IngestionResult.ErrorType.UNSUPPORTED_FORMAT
                        : IngestionResult.ErrorType.CONVERSION_FAILED, e.getMessage());
            }

            int chunkCount;
            try {
                chunkCount = retrievalService.indexDocument(session.getVectorIndex(), sourceId, document.chunks());
            } catch (EmbeddingException e) {
                log.error("Embedding failed for {}: {}", sourceId, e.getMessage());
                return IngestionResult.failure(sourceId, IngestionResult.ErrorType.EMBEDDING_FAILED, e.getMessage());
            }

            String summary = suppliedSummary != null && !suppliedSummary.isBlank()
                    ? suppliedSummary.strip()
                    : summaryService.summarizeFile(sourceId, document.markdown());
            ConversationState state = session.getState();
            state.getProjectState().putFileSummary(new FileSummary(sourceId, summary, chunkCount));
            persist(state);
            return IngestionResult.success(sourceId, chunkCount, summary);
        } finally {
            session.getLock().unlock();
        }
    }

    public List<FileSummary> documents(String conversationId) {
        ConversationSession session = registry.require(conversationId);
        session.getLock().lock();
        try {
            return List.copyOf(session.getState().getProjectState().getFileSummaries());
        } finally {
            session.getLock().unlock();
        }
    }

    /**
     * Deletes the document's chunks, its file summary and the raw file.
     *
     * @return number of chunks removed
     */
    public int removeDocument(String conversationId, String sourceId) {
        ConversationSession session = registry.require(conversationId);
        session.getLock().lock();
        try {
            int removed = retrievalService.removeDocument(session.getVectorIndex(), sourceId);
            ConversationState state = session.getState();
            state.getProjectState().removeFileSummary(sourceId);
            rawDocumentStore.delete(conversationId, sourceId);
            persist(state);
            return removed;
        } finally {
            session.getLock().unlock();
        }
    }
}
