package com.purchasingpower.forge.agent;

import com.purchasingpower.forge.agent.impl.ToolContextImpl;
import com.purchasingpower.forge.model.assumption.Assumption;
import com.purchasingpower.forge.model.assumption.AssumptionStatus;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import com.purchasingpower.forge.model.routing.ConversationPhase;
import com.purchasingpower.forge.model.routing.GuidanceFiring;
import com.purchasingpower.forge.routing.ConversationStateMachine;
import com.purchasingpower.forge.workspace.WorkspaceLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives every tool through the dispatcher the way the executor does, against the real
 * argument binding and validation.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Tool Dispatcher")
class ToolDispatcherTest {

    @Autowired
    private ToolDispatcher dispatcher;

    @Autowired
    private ConversationStateMachine stateMachine;

    @Autowired
    private WorkspaceLayout workspaceLayout;

    private ConversationState state;
    private ToolContextImpl context;

    @BeforeEach
    void setUp() {
        state = new ConversationState("tools-" + UUID.randomUUID(), 8);
        state.getRoutingContext().setTurnCount(3);
        context = ToolContextImpl.create(state);
    }

    private ToolResult call(String tool, Map<String, Object> arguments) {
        return dispatcher.dispatch(tool, arguments, context);
    }

    private String register(String claim, List<String> dependsOn) {
        ToolResult result = call("register_assumption", Map.of(
                "claim", claim,
                "type", "value",
                "impact", "high",
                "confidence", "guessed",
                "basis", "stated by the user",
                "surfaced_by", "Problem Clarity",
                "depends_on", dependsOn));
        assertThat(result.isSuccess()).as(result.getMessage()).isTrue();
        return state.getFactStore().all().get(state.getFactStore().all().size() - 1).getId();
    }

    @Test
    @DisplayName("Should expose a definition for every registered tool")
    void testDefinitions() {
        assertThat(dispatcher.definitions()).hasSize(dispatcher.toolNames().size());
        assertThat(dispatcher.toolNames()).contains(
                "register_assumption", "update_assumption_status", "update_assumption_confidence",
                "update_problem_statement", "update_target_audience", "add_stakeholder",
                "update_success_metrics", "add_decision_criteria", "generate_artifact",
                "record_probe_fired", "record_pattern_fired", "update_conversation_summary",
                "update_org_context", "complete_mode", "set_solution_info", "set_risk_assessment",
                "set_validation_plan", "set_go_no_go");
    }

    @Test
    @DisplayName("Should report an unknown tool with the list of valid ones")
    void testDispatch_UnknownTool() {
        ToolResult result = call("delete_everything", Map.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).startsWith("Unknown tool: delete_everything").contains("register_assumption");
        assertThat(context.getMutations()).isEmpty();
    }

    @Test
    @DisplayName("Should reject missing or malformed arguments without mutating state")
    void testDispatch_InvalidArguments() {
        // When
        ToolResult missing = call("register_assumption", Map.of("claim", "Users want it"));
        ToolResult badEnum = call("add_stakeholder", Map.of("name", "CFO", "type", "overlord"));

        // Then
        assertThat(missing.isSuccess()).isFalse();
        assertThat(missing.getMessage()).startsWith("Error: Invalid arguments for register_assumption").contains("basis");
        assertThat(badEnum.isSuccess()).isFalse();
        assertThat(state.getFactStore().all()).isEmpty();
        assertThat(state.getFactStore().getSkeleton().getStakeholders()).isEmpty();
        assertThat(context.getMutations()).isEmpty();
    }

    @Test
    @DisplayName("Should cascade an invalidation to dependents and log one mutation")
    void testUpdateStatus_Cascade() {
        // Given
        String root = register("Managers check the dashboard daily", List.of());
        String dependent = register("Daily checks reduce stockouts", List.of(root));

        // When
        ToolResult result = call("update_assumption_status", Map.of(
                "assumption_id", root, "new_status", "invalidated", "reason", "survey shows weekly checks"));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).contains(dependent);
        Assumption cascaded = state.getFactStore().find(dependent).orElseThrow();
        assertThat(cascaded.getStatus()).isEqualTo(AssumptionStatus.AT_RISK);
        assertThat(context.getMutations()).contains("registered " + root, "registered " + dependent);
        assertThat(context.getMutations().get(2)).startsWith(root + " -> invalidated (cascade: 1)");
    }

    @Test
    @DisplayName("Should return an error for an unknown assumption id")
    void testUpdateStatus_UnknownId() {
        ToolResult result = call("update_assumption_status", Map.of(
                "assumption_id", "A99", "new_status", "confirmed", "reason", "n/a"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).contains("A99");
    }

    @Test
    @DisplayName("Should warn instead of rendering an incomplete brief, then render once populated")
    void testGenerateArtifact() throws Exception {
        // Given
        ToolResult early = call("generate_artifact", Map.of("artifact_type", "problem_brief"));

        call("update_problem_statement", Map.of("text", "Stores learn about late trucks too late to react"));
        call("add_stakeholder", Map.of("name", "VP Stores", "type", "decision_authority", "validated", true));
        call("update_success_metrics", Map.of("leading", "Alerts acknowledged", "anti_metric", "Alert fatigue"));
        call("add_decision_criteria", Map.of("criteria_type", "proceed_if", "condition", "Late trucks drive stockouts"));

        // When
        ToolResult rendered = call("generate_artifact", Map.of("artifact_type", "problem_brief"));

        // Then
        assertThat(early.isSuccess()).isFalse();
        assertThat(early.getMessage()).startsWith("WARNING: The following skeleton fields are empty");
        assertThat(early.hasArtifact()).isFalse();

        assertThat(rendered.isSuccess()).isTrue();
        assertThat(rendered.hasArtifact()).isTrue();
        assertThat(rendered.getMessage()).isEqualTo("Artifact rendered and displayed to user.");
        assertThat(state.getLatestArtifact()).isEqualTo(rendered.getArtifact());
        assertThat(Files.readString(workspaceLayout.artifactsDir(state.getConversationId()).resolve("problem_brief.md")))
                .contains("Stores learn about late trucks too late to react");
    }

    @Test
    @DisplayName("Should canonicalise probe names and keep unknown ones as given")
    void testRecordProbeFired() {
        // When
        call("record_probe_fired", Map.of("probe_name", "probe 1: problem clarity", "summary", "asked about root cause"));
        call("record_probe_fired", Map.of("probe_name", "Something Custom"));

        // Then
        List<GuidanceFiring> fired = state.getRoutingContext().getProbesFired();
        assertThat(fired).extracting(GuidanceFiring::getName).containsExactly("Problem Clarity", "Something Custom");
        assertThat(fired.get(0).getTurn()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should complete the active mode even when another mode is named")
    void testCompleteMode() {
        // Given
        ToolResult idle = call("complete_mode", Map.of("mode_completed", "mode_1", "summary", "done"));
        stateMachine.enter(state, AnalysisMode.MODE_2);

        // When
        ToolResult result = call("complete_mode", Map.of("mode_completed", "mode_1", "summary", "evaluated"));

        // Then
        assertThat(idle.isSuccess()).isFalse();
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).startsWith("Mode mode_2 complete. System returned to context gathering.");
        assertThat(state.getPhase()).isEqualTo(ConversationPhase.GATHERING);
        assertThat(state.getActiveMode()).isNull();
    }

    @Test
    @DisplayName("Should stop accepting public context at the enrichment cap")
    void testUpdateOrgContext_Cap() {
        // Given
        state.getOrgContext().setEnrichmentCount(3);

        // When
        ToolResult result = call("update_org_context", Map.of(
                "company", "Acme Retail",
                "domain", "logistics",
                "public_context", "Acme runs 400 stores",
                "internal_context", "Ops team is 12 people"));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).contains("enrichment limit of 3 reached");
        assertThat(state.getOrgContext().getPublicContext()).isEmpty();
        assertThat(state.getOrgContext().getInternalContext()).isEqualTo("Ops team is 12 people");
        assertThat(state.getOrgContext().getEnrichmentCount()).isEqualTo(3);
        assertThat(Files.exists(workspaceLayout.contextFile(state.getConversationId()))).isTrue();
    }

    @Test
    @DisplayName("Should flag the summary as written for this turn")
    void testUpdateConversationSummary() {
        ToolResult result = call("update_conversation_summary", Map.of("summary", "  Problem framed; metrics open.  "));

        assertThat(result.isSuccess()).isTrue();
        assertThat(context.isSummaryUpdated()).isTrue();
        assertThat(state.getRoutingContext().getConversationSummary()).isEqualTo("Problem framed; metrics open.");
        assertThat(state.getRoutingContext().getSummaryTurn()).isEqualTo(3);
    }
}
