package com.purchasingpower.forge.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.knowledge.impl.YamlKnowledgeIndex;
import com.purchasingpower.forge.model.chunk.LeafChunk;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.retrieval.ContextBundle;
import com.purchasingpower.forge.model.routing.NextAction;
import com.purchasingpower.forge.model.routing.RoutingDecision;
import com.purchasingpower.forge.support.KeywordEmbeddingClient;
import com.purchasingpower.forge.vector.VectorIndex;
import com.purchasingpower.forge.vector.impl.InMemoryVectorIndex;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("Context Assembler")
class ContextAssemblerTest {

    private static YamlKnowledgeIndex knowledgeIndex;

    private KeywordEmbeddingClient embeddingClient;
    private VectorRetrievalService retrievalService;
    private ContextAssembler assembler;
    private ConversationState state;

    @BeforeAll
    static void loadKnowledge() {
        knowledgeIndex = new YamlKnowledgeIndex();
        knowledgeIndex.load();
    }

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        embeddingClient = new KeywordEmbeddingClient();
        retrievalService = new VectorRetrievalService(embeddingClient, properties, new ObjectMapper());
        assembler = new ContextAssembler(knowledgeIndex, retrievalService, properties);
        state = new ConversationState("c1", 8);
    }

    @Test
    @DisplayName("Should not touch the vector index for an acknowledgement turn")
    void testAssemble_BypassForContinuation() {
        // Given
        VectorIndex vectorIndex = mock(VectorIndex.class);
        RoutingDecision decision = RoutingDecision.builder()
                .nextAction(NextAction.CONTINUE_MODE)
                .nextProbe("Who Feels It")
                .triggeredPatterns(List.of("Proxy Customer"))
                .requiresRetrieval(false)
                .build();

        // When
        ContextBundle bundle = assembler.assemble("yes, continue", decision, 4, state, vectorIndex);

        // Then
        verifyNoInteractions(vectorIndex);
        assertThat(embeddingClient.getQueryCalls()).isZero();
        assertThat(bundle.isRetrievalPerformed()).isFalse();
        assertThat(bundle.getActiveGuidance()).isNotNull();
        assertThat(bundle.getActiveGuidance().key()).isEqualTo("Who Feels It");
        assertThat(bundle.getTriggeredPatterns()).isEmpty();
        assertThat(bundle.getDocuments()).isEmpty();
        assertThat(bundle.getSkeleton()).isNotNull();
    }

    @Test
    @DisplayName("Should add patterns and retrieved sections when retrieval is required")
    void testAssemble_WithRetrieval() {
        // Given
        VectorIndex vectorIndex = new InMemoryVectorIndex(null, new ObjectMapper());
        retrievalService.indexDocument(vectorIndex, "survey.md", List.of(LeafChunk.builder()
                .sourceId("survey.md").chunkIndex(0).text("store managers report stockouts weekly")
                .headerPath(List.of("Survey")).level(1).contextHeader("[Source: survey.md > Survey]")
                .parentId("p1").parentText("Store managers report stockouts weekly.").leafIndex(0).build()));
        RoutingDecision decision = RoutingDecision.builder()
                .nextAction(NextAction.ASK_QUESTIONS)
                .nextProbe("Evidence of Pain")
                .triggeredPatterns(List.of("Proxy Customer", "Not A Pattern"))
                .requiresRetrieval(true)
                .build();

        // When
        ContextBundle bundle = assembler.assemble("How often do stockouts happen?", decision, 2, state, vectorIndex);

        // Then
        assertThat(bundle.isRetrievalPerformed()).isTrue();
        assertThat(bundle.isRetrievalDegraded()).isFalse();
        assertThat(bundle.getTriggeredPatterns()).extracting(unit -> unit.key()).containsExactly("Proxy Customer");
        assertThat(bundle.getDocuments()).hasSize(1);
        assertThat(bundle.getDocuments().get(0).parentText()).contains("stockouts");
    }

    @Test
    @DisplayName("Should degrade to always-on context when embedding fails")
    void testAssemble_EmbeddingFailure() {
        // Given
        VectorIndex vectorIndex = new InMemoryVectorIndex(null, new ObjectMapper());
        retrievalService.indexDocument(vectorIndex, "survey.md", List.of(LeafChunk.builder()
                .sourceId("survey.md").chunkIndex(0).text("stockouts").headerPath(List.of("Survey")).level(1)
                .contextHeader("[Source: survey.md]").parentId("p1").parentText("stockouts").leafIndex(0).build()));
        embeddingClient.setFailing(true);
        RoutingDecision decision = RoutingDecision.conservativeDefault("router unavailable");

        // When
        ContextBundle bundle = assembler.assemble("What about stockouts?", decision, 5, state, vectorIndex);

        // Then
        assertThat(bundle.isRetrievalDegraded()).isTrue();
        assertThat(bundle.getDocuments()).isEmpty();
        assertThat(bundle.getConversationTurns()).isEmpty();
        assertThat(bundle.getActiveGuidance()).isNull();
    }

    @Test
    @DisplayName("Should leave the active guidance empty for an unknown key")
    void testAssemble_UnknownGuidance() {
        RoutingDecision decision = RoutingDecision.builder()
                .nextAction(NextAction.ASK_QUESTIONS).nextProbe("Probe 99").requiresRetrieval(false).build();

        ContextBundle bundle = assembler.assemble("hi", decision, 1, state, mock(VectorIndex.class));

        assertThat(bundle.getActiveGuidance()).isNull();
    }
}
