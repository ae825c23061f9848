package com.purchasingpower.forge.routing;

import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import com.purchasingpower.forge.model.routing.ConversationPhase;
import com.purchasingpower.forge.model.routing.NextAction;
import com.purchasingpower.forge.model.routing.RoutingDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Conversation State Machine")
class ConversationStateMachineTest {

    private ConversationStateMachine stateMachine;
    private ConversationState state;

    @BeforeEach
    void setUp() {
        stateMachine = new ConversationStateMachine(new AppProperties());
        state = new ConversationState("c1", 8);
    }

    private static RoutingDecision.RoutingDecisionBuilder decision(NextAction action) {
        return RoutingDecision.builder().nextAction(action).requiresRetrieval(true);
    }

    @Test
    @DisplayName("Should enter problem discovery and mark critical mass")
    void testApplyDecision_EnterMode() {
        // When
        stateMachine.applyDecision(state, decision(NextAction.ENTER_MODE).enterMode(AnalysisMode.MODE_1).build());

        // Then
        assertThat(state.getPhase()).isEqualTo(ConversationPhase.MODE_ACTIVE);
        assertThat(state.getActiveMode()).isEqualTo(AnalysisMode.MODE_1);
        assertThat(state.getRoutingContext().isCriticalMassReached()).isTrue();
        assertThat(state.getRoutingContext().getLastDecision()).isNotNull();
    }

    @Test
    @DisplayName("Should complete the active mode when the router flags it")
    void testApplyDecision_CompleteModeSafetyNet() {
        // Given
        stateMachine.enter(state, AnalysisMode.MODE_2);
        state.getFactStore().setSolutionInfo("Carrier portal", "Self-serve tracking", "buy");
        state.getFactStore().setProblemStatement("Shipments arrive late");

        // When
        stateMachine.applyDecision(state, decision(NextAction.COMPLETE_MODE).build());

        // Then
        assertThat(state.getPhase()).isEqualTo(ConversationPhase.GATHERING);
        assertThat(state.getActiveMode()).isNull();
        assertThat(state.getFactStore().getSkeleton().getSolutionEvaluation().getSolutionName()).isNull();
        assertThat(state.getFactStore().getSkeleton().getProblemStatement()).isEqualTo("Shipments arrive late");
    }

    @Test
    @DisplayName("Should ignore complete_mode while gathering")
    void testApplyDecision_CompleteWhileGathering() {
        stateMachine.applyDecision(state, decision(NextAction.COMPLETE_MODE).build());

        assertThat(state.getPhase()).isEqualTo(ConversationPhase.GATHERING);
    }

    @Test
    @DisplayName("Should count mode turns and flag micro-synthesis on the configured cadence")
    void testAfterTurn() {
        // Given
        stateMachine.enter(state, AnalysisMode.MODE_1);

        // When
        for (int turn = 1; turn <= 3; turn++) {
            state.getRoutingContext().setTurnCount(turn);
            stateMachine.afterTurn(state);
            if (turn < 3) {
                assertThat(state.getRoutingContext().isMicroSynthesisDue()).isFalse();
            }
        }

        // Then
        assertThat(state.getRoutingContext().isMicroSynthesisDue()).isTrue();
        assertThat(state.getRoutingContext().getModeTurnCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should suppress enrichment once the cap is reached")
    void testGateEnrichment_Cap() {
        // Given
        state.getOrgContext().setEnrichmentCount(3);
        RoutingDecision requested = decision(NextAction.ASK_QUESTIONS)
                .enrichmentNeeded(true).enrichmentQuery("warehouse labour").problemDomain("logistics").build();

        // When
        RoutingDecision gated = stateMachine.applyDecision(state, requested);

        // Then
        assertThat(gated.isEnrichmentNeeded()).isFalse();
        assertThat(gated.getEnrichmentQuery()).isNull();
    }

    @Test
    @DisplayName("Should suppress enrichment when the domain has not changed")
    void testGateEnrichment_SameDomain() {
        // Given
        state.getOrgContext().setEnrichmentCount(1);
        state.getOrgContext().setLastEnrichedDomain("Logistics");

        // When
        RoutingDecision same = stateMachine.gateEnrichment(decision(NextAction.ASK_QUESTIONS)
                .enrichmentNeeded(true).problemDomain(" logistics ").build(), state.getOrgContext());
        RoutingDecision shifted = stateMachine.gateEnrichment(decision(NextAction.ASK_QUESTIONS)
                .enrichmentNeeded(true).problemDomain("marketing").build(), state.getOrgContext());

        // Then
        assertThat(same.isEnrichmentNeeded()).isFalse();
        assertThat(shifted.isEnrichmentNeeded()).isTrue();
    }
}
