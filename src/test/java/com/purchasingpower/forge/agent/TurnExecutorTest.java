package com.purchasingpower.forge.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.client.generation.ContentBlock;
import com.purchasingpower.forge.client.generation.GenerationMessage;
import com.purchasingpower.forge.client.generation.GenerationRequest;
import com.purchasingpower.forge.config.GeminiConfig;
import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.exception.GenerationException;
import com.purchasingpower.forge.model.conversation.ChatMessage;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.retrieval.ContextBundle;
import com.purchasingpower.forge.model.routing.NextAction;
import com.purchasingpower.forge.model.routing.RoutingDecision;
import com.purchasingpower.forge.model.skeleton.CriterionType;
import com.purchasingpower.forge.model.skeleton.StakeholderType;
import com.purchasingpower.forge.prompt.PromptContextFormatter;
import com.purchasingpower.forge.prompt.PromptLibraryService;
import com.purchasingpower.forge.support.ScriptedGenerationClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.purchasingpower.forge.support.ScriptedGenerationClient.text;
import static com.purchasingpower.forge.support.ScriptedGenerationClient.toolCall;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Turn Executor")
class TurnExecutorTest {

    @Autowired
    private ToolDispatcher toolDispatcher;

    @Autowired
    private PromptLibraryService promptLibrary;

    @Autowired
    private PromptContextFormatter formatter;

    @Autowired
    private GeminiConfig geminiConfig;

    @Autowired
    private AppProperties appProperties;

    @Autowired
    private ObjectMapper objectMapper;

    private ScriptedGenerationClient generationClient;
    private TurnExecutor executor;
    private ConversationState state;
    private RoutingDecision decision;

    @BeforeEach
    void setUp() {
        generationClient = new ScriptedGenerationClient();
        executor = new TurnExecutor(generationClient, toolDispatcher, promptLibrary, formatter,
                geminiConfig, appProperties, objectMapper);
        state = new ConversationState("exec-" + UUID.randomUUID(), 8);
        state.getRoutingContext().setTurnCount(1);
        decision = RoutingDecision.builder().nextAction(NextAction.ASK_QUESTIONS).requiresRetrieval(false).build();
    }

    private ContextBundle bundle() {
        return ContextBundle.builder()
                .orgContext(state.getOrgContext())
                .assumptions(state.getFactStore().all())
                .skeleton(state.getFactStore().getSkeleton())
                .routingContext(state.getRoutingContext())
                .build();
    }

    private ExecutionResult run(String message) {
        return executor.execute(message, decision, bundle(), state);
    }

    private static List<ContentBlock.ToolResult> toolResults(GenerationRequest request) {
        GenerationMessage last = request.getMessages().get(request.getMessages().size() - 1);
        return last.blocks().stream()
                .filter(ContentBlock.ToolResult.class::isInstance)
                .map(ContentBlock.ToolResult.class::cast)
                .toList();
    }

    @Test
    @DisplayName("Should return plain text and offer every tool to the model")
    void testExecute_TextOnly() {
        // Given
        generationClient.then(text("What outcome would tell you this worked?"));

        // When
        ExecutionResult result = run("We want a dashboard for late shipments");

        // Then
        assertThat(result.responseText()).isEqualTo("What outcome would tell you this worked?");
        assertThat(result.failed()).isFalse();
        assertThat(result.iterations()).isEqualTo(1);
        GenerationRequest request = generationClient.getRequests().get(0);
        assertThat(request.getCaller()).isEqualTo(GeminiConfig.CALLER_EXECUTOR);
        assertThat(request.getTools()).hasSize(toolDispatcher.toolNames().size());
    }

    @Test
    @DisplayName("Should apply tool calls and feed their results back to the model")
    void testExecute_ToolLoop() {
        // Given
        generationClient
                .then(text("Let me note that. "),
                        toolCall("register_assumption", """
                                {"claim": "Stores check email daily", "type": "organizational", "impact": "high",
                                 "confidence": "guessed", "basis": "user said so", "surfaced_by": "Who Feels It"}
                                """),
                        toolCall("update_conversation_summary", "{\"summary\": \"Dashboard idea, pain unclear.\"}"))
                .then(text("Who feels the delays most?"));

        // When
        ExecutionResult result = run("Stores complain about late trucks");

        // Then
        assertThat(result.responseText()).isEqualTo("Let me note that. Who feels the delays most?");
        assertThat(result.mutationsApplied()).containsExactly("registered A1");
        assertThat(result.summaryUpdated()).isTrue();
        assertThat(result.iterations()).isEqualTo(2);
        assertThat(state.getFactStore().find("A1")).isPresent();
        assertThat(toolResults(generationClient.getRequests().get(1)))
                .extracting(ContentBlock.ToolResult::error)
                .containsExactly(false, false);
    }

    @Test
    @DisplayName("Should show a rendered artifact to the user and only acknowledge it to the model")
    void testExecute_ArtifactAcknowledgement() {
        // Given
        state.getFactStore().setProblemStatement("Stores learn about late trucks too late");
        state.getFactStore().addStakeholder("VP Stores", StakeholderType.DECISION_AUTHORITY, true, null);
        state.getFactStore().updateSuccessMetrics("Alerts acknowledged", null, null);
        state.getFactStore().addDecisionCriterion(CriterionType.PROCEED_IF, "Late trucks drive stockouts");
        generationClient
                .then(text("Here is the brief."), toolCall("generate_artifact", "{\"artifact_type\": \"problem_brief\"}"))
                .then(text("\n\nStart by validating A1."));

        // When
        ExecutionResult result = run("Please write it up");

        // Then
        assertThat(result.artifact()).startsWith("# Problem Brief");
        assertThat(result.responseText())
                .startsWith("Here is the brief.\n\n# Problem Brief")
                .endsWith("Start by validating A1.");
        List<ContentBlock.ToolResult> fedBack = toolResults(generationClient.getRequests().get(1));
        assertThat(fedBack).hasSize(1);
        assertThat(fedBack.get(0).content()).isEqualTo("Artifact rendered and displayed to user.");
        assertThat(fedBack.get(0).content()).doesNotContain("Stores learn about late trucks");
    }

    @Test
    @DisplayName("Should answer an unknown tool with an error result and continue")
    void testExecute_UnknownTool() {
        generationClient.then(toolCall("book_meeting", "{}")).then(text("Understood."));

        ExecutionResult result = run("hi");

        assertThat(result.responseText()).isEqualTo("Understood.");
        ContentBlock.ToolResult fedBack = toolResults(generationClient.getRequests().get(1)).get(0);
        assertThat(fedBack.error()).isTrue();
        assertThat(fedBack.content()).startsWith("Unknown tool: book_meeting");
    }

    @Test
    @DisplayName("Should keep partial text and applied mutations when the loop fails midway")
    void testExecute_PartialFailure() {
        // Given
        generationClient
                .then(text("Noted the first point."), toolCall("update_problem_statement", "{\"text\": \"Late trucks\"}"))
                .thenFail(new GenerationException("gemini-2.5-pro", "503 after retries"));

        // When
        ExecutionResult result = run("Trucks are late");

        // Then
        assertThat(result.failed()).isTrue();
        assertThat(result.responseText()).isEqualTo("Noted the first point." + TurnExecutor.PARTIAL_WARNING);
        assertThat(result.mutationsApplied()).containsExactly("problem statement");
        assertThat(state.getFactStore().getSkeleton().getProblemStatement()).isEqualTo("Late trucks");
    }

    @Test
    @DisplayName("Should return the standard error text when the first call fails")
    void testExecute_ImmediateFailure() {
        generationClient.thenFail(new GenerationException("gemini-2.5-pro", "timeout"));

        ExecutionResult result = run("hello");

        assertThat(result.failed()).isTrue();
        assertThat(result.responseText()).isEqualTo(TurnExecutor.ERROR_TEXT);
        assertThat(result.mutationsApplied()).isEmpty();
    }

    @Test
    @DisplayName("Should substitute a fallback when the model produces no visible text")
    void testExecute_EmptyResponse() {
        generationClient.then(toolCall("update_conversation_summary", "{\"summary\": \"s\"}")).then();

        ExecutionResult result = run("ok");

        assertThat(result.responseText()).isEqualTo(TurnExecutor.EMPTY_FALLBACK);
        assertThat(result.failed()).isFalse();
    }

    @Test
    @DisplayName("Should stop after the configured number of tool iterations")
    void testExecute_IterationCap() {
        // Given
        int max = appProperties.getConversation().getMaxToolIterations();
        for (int i = 0; i < max; i++) {
            generationClient.then(toolCall("record_probe_fired", "{\"probe_name\": \"Problem Clarity\"}"));
        }

        // When
        ExecutionResult result = run("go");

        // Then
        assertThat(result.iterations()).isEqualTo(max);
        assertThat(generationClient.getRequests()).hasSize(max);
        assertThat(state.getRoutingContext().getProbesFired()).hasSize(max);
    }

    @Test
    @DisplayName("Should keep the first message and the most recent ones when truncating")
    void testTruncate() {
        // Given
        List<ChatMessage> history = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            history.add(i % 2 == 0 ? ChatMessage.user("u" + i) : ChatMessage.assistant("a" + i));
        }

        // When
        List<ChatMessage> truncated = TurnExecutor.truncate(history, 20);

        // Then
        assertThat(truncated).hasSize(22);
        assertThat(truncated.get(0).getContent()).isEqualTo("u0");
        assertThat(truncated.get(1).getContent()).isEqualTo(TurnExecutor.TRUNCATION_MARKER);
        assertThat(truncated.get(2).getContent()).isEqualTo("u10");
        assertThat(truncated.get(21).getContent()).isEqualTo("a29");
    }
}
