package com.purchasingpower.forge.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.model.assumption.AssumptionCategory;
import com.purchasingpower.forge.model.assumption.AssumptionStatus;
import com.purchasingpower.forge.model.assumption.Confidence;
import com.purchasingpower.forge.model.assumption.Impact;
import com.purchasingpower.forge.model.assumption.NewAssumption;
import com.purchasingpower.forge.model.conversation.ChatMessage;
import com.purchasingpower.forge.model.conversation.ConversationSnapshot;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import com.purchasingpower.forge.model.routing.ConversationPhase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Snapshot Store")
class SnapshotStoreTest {

    @Autowired
    private SnapshotStore snapshotStore;

    @Autowired
    private ObjectMapper objectMapper;

    private static ConversationState populatedState(String id) {
        ConversationState state = new ConversationState(id, 8);
        state.getRoutingContext().setTurnCount(4);
        state.setPhase(ConversationPhase.MODE_ACTIVE);
        state.setActiveMode(AnalysisMode.MODE_1);
        state.getMessages().add(ChatMessage.user("Trucks are late"));
        state.getMessages().add(ChatMessage.assistant("Who feels it?"));
        state.getFactStore().registerAssumption(NewAssumption.builder()
                .claim("Managers act on alerts")
                .category(AssumptionCategory.VALUE)
                .impact(Impact.HIGH)
                .confidence(Confidence.GUESSED)
                .basis("stated by user")
                .build(), 2);
        state.getFactStore().registerAssumption(NewAssumption.builder()
                .claim("Alerts arrive a day ahead")
                .category(AssumptionCategory.TECHNICAL)
                .impact(Impact.MEDIUM)
                .confidence(Confidence.INFORMED)
                .basis("carrier API")
                .dependsOn(List.of("A1"))
                .build(), 3);
        state.getFactStore().setProblemStatement("Stores learn about delays too late");
        return state;
    }

    @Test
    @DisplayName("Should restore the full state through JSON")
    void testCaptureAndRestore_ThroughJson() throws Exception {
        // Given
        ConversationState original = populatedState("snap-source");
        String json = objectMapper.writeValueAsString(snapshotStore.capture(original));

        // When
        ConversationState restored = snapshotStore.restore("snap-target",
                objectMapper.readValue(json, ConversationSnapshot.class));

        // Then
        assertThat(restored.getConversationId()).isEqualTo("snap-target");
        assertThat(restored.getCurrentTurn()).isEqualTo(4);
        assertThat(restored.getPhase()).isEqualTo(ConversationPhase.MODE_ACTIVE);
        assertThat(restored.getActiveMode()).isEqualTo(AnalysisMode.MODE_1);
        assertThat(restored.getMessages()).hasSize(2);
        assertThat(restored.getFactStore().getSkeleton().getProblemStatement()).isEqualTo("Stores learn about delays too late");

        // the dependency graph is rebuilt, so cascades still work
        restored.getFactStore().updateStatus("A1", AssumptionStatus.INVALIDATED, "stores ignore alerts", 5);
        assertThat(restored.getFactStore().find("A2")).get()
                .satisfies(a -> assertThat(a.getStatus()).isEqualTo(AssumptionStatus.AT_RISK));
    }

    @Test
    @DisplayName("Should keep defaults for keys missing from an older snapshot")
    void testRestore_PartialSnapshot() throws Exception {
        // Given
        String json = """
                {"schemaVersion": "0.9", "conversationId": "old", "routingContext": {"turnCount": 2}}
                """;

        // When
        ConversationState restored = snapshotStore.restore("old", objectMapper.readValue(json, ConversationSnapshot.class));

        // Then
        assertThat(restored.getCurrentTurn()).isEqualTo(2);
        assertThat(restored.getRoutingContext().isRequiresRetrieval()).isTrue();
        assertThat(restored.getRoutingContext().getConversationSummary()).isEmpty();
        assertThat(restored.getPhase()).isEqualTo(ConversationPhase.GATHERING);
        assertThat(restored.getMessages()).isEmpty();
        assertThat(restored.getFactStore().all()).isEmpty();
        assertThat(restored.getOrgContext().getEnrichmentCount()).isZero();
        assertThat(restored.getProjectState().getFileSummaries()).isEmpty();
    }

    @Test
    @DisplayName("Should capture a copy detached from the live state")
    void testCapture_Detached() {
        ConversationState state = populatedState("snap-detached");
        ConversationSnapshot snapshot = snapshotStore.capture(state);

        state.getMessages().add(ChatMessage.user("later"));
        state.getRoutingContext().setTurnCount(9);

        assertThat(snapshot.getMessages()).hasSize(2);
        assertThat(snapshot.getRoutingContext().getTurnCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should save and load the latest snapshot")
    void testSaveAndLoad() {
        ConversationState state = populatedState("snap-saved");

        snapshotStore.save(snapshotStore.capture(state));

        assertThat(snapshotStore.load("snap-saved")).get()
                .satisfies(loaded -> assertThat(loaded.getFactStore().getAssumptions()).hasSize(2));
        assertThat(snapshotStore.load("never-saved")).isEmpty();
    }
}
