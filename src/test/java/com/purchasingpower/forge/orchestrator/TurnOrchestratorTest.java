package com.purchasingpower.forge.orchestrator;

import com.purchasingpower.forge.client.embedding.EmbeddingClient;
import com.purchasingpower.forge.client.generation.ContentBlock;
import com.purchasingpower.forge.client.generation.GenerationClient;
import com.purchasingpower.forge.client.generation.GenerationRequest;
import com.purchasingpower.forge.client.generation.GenerationResponse;
import com.purchasingpower.forge.config.GeminiConfig;
import com.purchasingpower.forge.exception.ConversationNotFoundException;
import com.purchasingpower.forge.exception.EmbeddingException;
import com.purchasingpower.forge.exception.StorageUnavailableException;
import com.purchasingpower.forge.model.conversation.ConversationSnapshot;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.conversation.FileSummary;
import com.purchasingpower.forge.support.KeywordEmbeddingClient;
import com.purchasingpower.forge.support.ScriptedGenerationClient;
import com.purchasingpower.forge.vector.VectorCollection;
import com.purchasingpower.forge.workspace.WorkspaceLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.util.FileSystemUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static com.purchasingpower.forge.support.ScriptedGenerationClient.text;
import static com.purchasingpower.forge.support.ScriptedGenerationClient.toolCall;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Full turns and document ingestion against the real Spring wiring, with the model and the
 * embedding backend replaced.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Turn Orchestrator")
class TurnOrchestratorTest {

    private static final String MARKDOWN = """
            # Customer Interviews

            Store managers said late trucks cause empty shelves every week. They learn about delays
            only when the truck fails to arrive.

            ## Quotes

            "We find out when the dock is empty." Managers want a warning a day ahead.
            """;

    @MockBean
    private GenerationClient generationClient;

    @MockBean
    private EmbeddingClient embeddingClient;

    @Autowired
    private TurnOrchestrator orchestrator;

    @Autowired
    private ConversationRegistry registry;

    @Autowired
    private SnapshotStore snapshotStore;

    @Autowired
    private RawDocumentStore rawDocumentStore;

    @Autowired
    private WorkspaceLayout workspaceLayout;

    private final KeywordEmbeddingClient embeddings = new KeywordEmbeddingClient();
    private final Deque<GenerationResponse> executorScript = new ArrayDeque<>();
    private String routerOutput;

    @BeforeEach
    void setUp() {
        routerOutput = "{\"next_action\": \"ask_questions\", \"requires_retrieval\": true}";
        when(generationClient.generate(any(GenerationRequest.class))).thenAnswer(invocation -> {
            GenerationRequest request = invocation.getArgument(0);
            return switch (request.getCaller()) {
                case GeminiConfig.CALLER_ROUTER -> response(text(routerOutput));
                case GeminiConfig.CALLER_EXECUTOR -> executorScript.isEmpty()
                        ? response(text("Who feels this most?"))
                        : executorScript.poll();
                default -> response(text("Summary of the exchange."));
            };
        });
        when(embeddingClient.embedDocuments(anyList())).thenAnswer(invocation -> embeddings.embedDocuments(invocation.getArgument(0)));
        when(embeddingClient.embedQuery(anyString())).thenAnswer(invocation -> embeddings.embedQuery(invocation.getArgument(0)));
    }

    private static GenerationResponse response(ContentBlock... blocks) {
        return new GenerationResponse(List.of(blocks), "STOP");
    }

    private ConversationState stateOf(String conversationId) {
        return registry.require(conversationId).getState();
    }

    @Test
    @DisplayName("Should run a turn end to end and persist a snapshot")
    void testHandleMessage_FirstTurn() {
        // Given
        String id = orchestrator.createConversation();
        executorScript.add(response(text("Got it. "), toolCall("update_conversation_summary",
                "{\"summary\": \"User wants delay alerts for stores.\"}")));
        executorScript.add(response(text("Who feels the delays most?")));

        // When
        TurnOutcome outcome = orchestrator.handleMessage(id, "We need alerts for late trucks");

        // Then
        assertThat(outcome.turnNumber()).isEqualTo(1);
        assertThat(outcome.response()).isEqualTo("Got it. Who feels the delays most?");
        assertThat(outcome.degraded()).isFalse();
        ConversationState state = stateOf(id);
        assertThat(state.getMessages()).hasSize(2);
        assertThat(state.getRoutingContext().getConversationSummary()).isEqualTo("User wants delay alerts for stores.");
        assertThat(snapshotStore.load(id)).get()
                .satisfies(snapshot -> assertThat(snapshot.getMessages()).hasSize(2));
    }

    @Test
    @DisplayName("Should synthesise the rolling summary when the executor skipped it")
    void testHandleMessage_SynthesisedSummary() {
        String id = orchestrator.createConversation();

        orchestrator.handleMessage(id, "Trucks are late");

        assertThat(stateOf(id).getRoutingContext().getConversationSummary()).startsWith("Turn 1, phase gathering");
        assertThat(stateOf(id).getRoutingContext().getSummaryTurn()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should skip retrieval entirely for an acknowledgement turn")
    void testHandleMessage_ContinuationBypassesRetrieval() {
        // Given
        String id = orchestrator.createConversation();
        orchestrator.ingestDocument(id, "interviews.md", MARKDOWN.getBytes(StandardCharsets.UTF_8), null, "Interviews");
        orchestrator.handleMessage(id, "Managers say shelves go empty");
        clearInvocations(embeddingClient);
        routerOutput = "{\"next_action\": \"continue_mode\", \"next_probe\": \"Who Feels It\"}";

        // When
        TurnOutcome outcome = orchestrator.handleMessage(id, "yes, continue");

        // Then
        assertThat(outcome.decision().isRequiresRetrieval()).isFalse();
        verify(embeddingClient, never()).embedQuery(anyString());
        assertThat(stateOf(id).getRoutingContext().isRequiresRetrieval()).isFalse();
    }

    @Test
    @DisplayName("Should index turns once they fall outside the always-on window")
    void testHandleMessage_TurnIndexing() {
        // Given
        String id = orchestrator.createConversation();

        // When
        for (int i = 1; i <= 4; i++) {
            orchestrator.handleMessage(id, "message " + i);
        }

        // Then
        assertThat(registry.require(id).getVectorIndex().count(VectorCollection.CONVERSATIONS)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a turn without changing state when storage is unavailable")
    void testHandleMessage_StorageUnavailable() throws Exception {
        // Given
        String id = orchestrator.createConversation();
        Path vectors = workspaceLayout.vectorsDir(id);
        FileSystemUtils.deleteRecursively(vectors);
        Files.createDirectories(vectors.getParent());
        Files.writeString(vectors, "not a directory");

        // When / Then
        assertThatThrownBy(() -> orchestrator.handleMessage(id, "hello"))
                .isInstanceOf(StorageUnavailableException.class);
        assertThat(stateOf(id).getCurrentTurn()).isZero();
        assertThat(stateOf(id).getMessages()).isEmpty();
        verify(generationClient, never()).generate(any(GenerationRequest.class));
    }

    @Test
    @DisplayName("Should report a broken DOCX, keep its raw file and still ingest the next document")
    void testIngestDocument_BrokenDocx() {
        // Given
        String id = orchestrator.createConversation();

        // When
        IngestionResult broken = orchestrator.ingestDocument(id, "broken.docx",
                "this is not a zip archive".getBytes(StandardCharsets.UTF_8), null, null);
        IngestionResult valid = orchestrator.ingestDocument(id, "interviews.md",
                MARKDOWN.getBytes(StandardCharsets.UTF_8), null, null);

        // Then
        assertThat(broken.success()).isFalse();
        assertThat(broken.errorType()).isEqualTo(IngestionResult.ErrorType.CONVERSION_FAILED);
        assertThat(rawDocumentStore.exists(id, "broken.docx")).isTrue();

        assertThat(valid.success()).isTrue();
        assertThat(valid.chunkCount()).isPositive();
        assertThat(valid.summary()).isEqualTo("Summary of the exchange.");
        assertThat(orchestrator.documents(id)).extracting(FileSummary::getSourceId).containsExactly("interviews.md");
    }

    @Test
    @DisplayName("Should refuse unsupported formats and report embedding failures")
    void testIngestDocument_Failures() {
        // Given
        String id = orchestrator.createConversation();

        // When
        IngestionResult image = orchestrator.ingestDocument(id, "diagram.png", new byte[]{1, 2, 3}, null, null);
        doThrow(new EmbeddingException("quota exhausted", 403, false)).when(embeddingClient).embedDocuments(anyList());
        IngestionResult notEmbedded = orchestrator.ingestDocument(id, "interviews.md",
                MARKDOWN.getBytes(StandardCharsets.UTF_8), "md", null);

        // Then
        assertThat(image.errorType()).isEqualTo(IngestionResult.ErrorType.UNSUPPORTED_FORMAT);
        assertThat(notEmbedded.errorType()).isEqualTo(IngestionResult.ErrorType.EMBEDDING_FAILED);
        assertThat(orchestrator.documents(id)).isEmpty();
    }

    @Test
    @DisplayName("Should remove a document's chunks, summary and raw file")
    void testRemoveDocument() {
        // Given
        String id = orchestrator.createConversation();
        IngestionResult ingested = orchestrator.ingestDocument(id, "interviews.md",
                MARKDOWN.getBytes(StandardCharsets.UTF_8), null, "Interview notes");

        // When
        int removed = orchestrator.removeDocument(id, "interviews.md");

        // Then
        assertThat(removed).isEqualTo(ingested.chunkCount());
        assertThat(orchestrator.documents(id)).isEmpty();
        assertThat(rawDocumentStore.exists(id, "interviews.md")).isFalse();
        assertThat(registry.require(id).getVectorIndex().count(VectorCollection.DOCUMENTS)).isZero();
    }

    @Test
    @DisplayName("Should restore a snapshot into another conversation")
    void testSnapshotAndRestore() {
        // Given
        String source = orchestrator.createConversation();
        executorScript.add(response(toolCall("register_assumption", """
                {"claim": "Managers read alerts", "type": "value", "impact": "high", "confidence": "guessed",
                 "basis": "assumed", "surfaced_by": "Problem Clarity"}
                """)));
        executorScript.add(response(text("Registered.")));
        orchestrator.handleMessage(source, "Alerts would help");
        ConversationSnapshot snapshot = orchestrator.snapshot(source);

        // When
        orchestrator.restore("restored-copy", snapshot);

        // Then
        ConversationState restored = stateOf("restored-copy");
        assertThat(restored.getConversationId()).isEqualTo("restored-copy");
        assertThat(restored.getCurrentTurn()).isEqualTo(1);
        assertThat(restored.getFactStore().find("A1")).get()
                .satisfies(a -> assertThat(a.getClaim()).isEqualTo("Managers read alerts"));
        assertThat(restored.getMessages()).hasSize(2);
    }

    @Test
    @DisplayName("Should reject unknown conversation ids")
    void testUnknownConversation() {
        assertThatThrownBy(() -> orchestrator.handleMessage("does-not-exist", "hi"))
                .isInstanceOf(ConversationNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.documents("../escape"))
                .isInstanceOf(ConversationNotFoundException.class);
    }
}
