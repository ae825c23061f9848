package com.purchasingpower.forge.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.model.chunk.LeafChunk;
import com.purchasingpower.forge.model.retrieval.RetrievedDocument;
import com.purchasingpower.forge.model.retrieval.RetrievedTurn;
import com.purchasingpower.forge.model.retrieval.TurnRecord;
import com.purchasingpower.forge.support.KeywordEmbeddingClient;
import com.purchasingpower.forge.vector.VectorCollection;
import com.purchasingpower.forge.vector.VectorIndex;
import com.purchasingpower.forge.vector.impl.InMemoryVectorIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Vector Retrieval Service")
class VectorRetrievalServiceTest {

    private KeywordEmbeddingClient embeddingClient;
    private VectorRetrievalService service;
    private VectorIndex index;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        embeddingClient = new KeywordEmbeddingClient();
        service = new VectorRetrievalService(embeddingClient, new AppProperties(), objectMapper);
        index = new InMemoryVectorIndex(null, objectMapper);
    }

    private static LeafChunk leaf(String sourceId, int index, String parentId, String text) {
        return LeafChunk.builder()
                .sourceId(sourceId)
                .chunkIndex(index)
                .text(text)
                .headerPath(List.of("Findings"))
                .level(1)
                .contextHeader("[Source: " + sourceId + " > Findings]")
                .parentId(parentId)
                .parentText("parent " + parentId)
                .leafIndex(index)
                .build();
    }

    private static TurnRecord turn(int number, String summary) {
        return TurnRecord.builder()
                .turnNumber(number)
                .summary(summary)
                .userMessage("user " + number)
                .assistantResponse("assistant " + number)
                .activeProbe(number % 2 == 0 ? "Who Feels It" : null)
                .activeMode("mode_1")
                .build();
    }

    @Test
    @DisplayName("Should return at most one section per parent")
    void testRetrieveDocuments_ParentDedup() {
        // Given
        service.indexDocument(index, "research.md", List.of(
                leaf("research.md", 0, "p1", "pricing complaints from enterprise customers"),
                leaf("research.md", 1, "p1", "pricing tiers confuse enterprise buyers"),
                leaf("research.md", 2, "p1", "pricing page bounce rate"),
                leaf("research.md", 3, "p2", "pricing benchmark against competitors")));

        // When
        List<RetrievedDocument> documents = service.retrieveDocuments(index, "enterprise pricing", null);

        // Then
        assertThat(documents).extracting(RetrievedDocument::parentId).containsExactlyInAnyOrder("p1", "p2");
        assertThat(documents).extracting(RetrievedDocument::parentText).contains("parent p1");
        assertThat(documents.get(0).score()).isGreaterThanOrEqualTo(documents.get(1).score());
    }

    @Test
    @DisplayName("Should replace a document's chunks on re-ingestion and remove them on request")
    void testIndexDocument_ReplaceAndRemove() {
        // Given
        service.indexDocument(index, "notes.md", List.of(leaf("notes.md", 0, "a", "one"), leaf("notes.md", 1, "a", "two")));
        service.indexDocument(index, "other.md", List.of(leaf("other.md", 0, "b", "three")));

        // When
        int stored = service.indexDocument(index, "notes.md", List.of(leaf("notes.md", 0, "c", "replacement")));

        // Then
        assertThat(stored).isEqualTo(1);
        assertThat(index.count(VectorCollection.DOCUMENTS)).isEqualTo(2);
        assertThat(service.removeDocument(index, "notes.md")).isEqualTo(1);
        assertThat(service.removeDocument(index, "notes.md")).isZero();
        assertThat(index.count(VectorCollection.DOCUMENTS)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should restrict document retrieval to one source when filtered")
    void testRetrieveDocuments_SourceFilter() {
        service.indexDocument(index, "a.md", List.of(leaf("a.md", 0, "pa", "churn analysis")));
        service.indexDocument(index, "b.md", List.of(leaf("b.md", 0, "pb", "churn interviews")));

        List<RetrievedDocument> documents = service.retrieveDocuments(index, "churn", "b.md");

        assertThat(documents).extracting(RetrievedDocument::sourceId).containsExactly("b.md");
    }

    @Test
    @DisplayName("Should skip embedding the query when nothing is indexed")
    void testRetrieveDocuments_EmptyIndex() {
        assertThat(service.retrieveDocuments(index, "anything", null)).isEmpty();
        assertThat(embeddingClient.getQueryCalls()).isZero();
    }

    @Test
    @DisplayName("Should only return turns older than the always-on window, oldest first")
    void testRetrieveConversations_Window() {
        // Given
        for (int n = 1; n <= 5; n++) {
            service.indexTurn(index, turn(n, "turn " + n + " discussed warehouse staffing"));
        }

        // When
        List<RetrievedTurn> turns = service.retrieveConversations(index, "warehouse staffing", 6, null);

        // Then
        assertThat(turns).extracting(RetrievedTurn::turnNumber).containsExactly(1, 2);
        assertThat(turns.get(0).userMessage()).isEqualTo("user 1");
        assertThat(turns.get(1).activeProbe()).isEqualTo("Who Feels It");
    }

    @Test
    @DisplayName("Should return nothing while every turn is inside the window")
    void testRetrieveConversations_EarlyTurns() {
        service.indexTurn(index, turn(1, "first turn"));

        assertThat(service.retrieveConversations(index, "first", 3, null)).isEmpty();
        assertThat(embeddingClient.getQueryCalls()).isZero();
    }

    @Test
    @DisplayName("Should filter older turns by guidance key")
    void testRetrieveConversations_ProbeFilter() {
        for (int n = 1; n <= 6; n++) {
            service.indexTurn(index, turn(n, "turn " + n + " about onboarding"));
        }

        List<RetrievedTurn> turns = service.retrieveConversations(index, "onboarding", 7, "Who Feels It");

        assertThat(turns).extracting(RetrievedTurn::turnNumber).containsExactly(2);
    }
}
