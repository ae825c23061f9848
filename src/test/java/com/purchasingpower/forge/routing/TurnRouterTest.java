package com.purchasingpower.forge.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.client.generation.ContentBlock;
import com.purchasingpower.forge.client.generation.GenerationClient;
import com.purchasingpower.forge.client.generation.GenerationRequest;
import com.purchasingpower.forge.client.generation.GenerationResponse;
import com.purchasingpower.forge.config.GeminiConfig;
import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.exception.GenerationException;
import com.purchasingpower.forge.knowledge.impl.YamlKnowledgeIndex;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import com.purchasingpower.forge.model.routing.NextAction;
import com.purchasingpower.forge.model.routing.RoutingDecision;
import com.purchasingpower.forge.prompt.PromptContextFormatter;
import com.purchasingpower.forge.prompt.PromptLibraryService;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Turn Router")
class TurnRouterTest {

    private static PromptLibraryService promptLibrary;
    private static YamlKnowledgeIndex knowledgeIndex;

    private final List<GenerationRequest> requests = new ArrayList<>();

    @BeforeAll
    static void loadResources() {
        promptLibrary = new PromptLibraryService();
        promptLibrary.loadPrompts();
        knowledgeIndex = new YamlKnowledgeIndex();
        knowledgeIndex.load();
    }

    private TurnRouter routerReplying(String output) {
        return router(request -> {
            requests.add(request);
            return new GenerationResponse(List.of(new ContentBlock.Text(output)), "STOP");
        });
    }

    private TurnRouter router(GenerationClient client) {
        return new TurnRouter(client, promptLibrary, new PromptContextFormatter(), knowledgeIndex,
                new FillerMessageDetector(), new GeminiConfig(), new AppProperties(), new ObjectMapper());
    }

    @Test
    @DisplayName("Should parse a complete routing decision")
    void testRoute_ParsesDecision() {
        // Given
        TurnRouter router = routerReplying("""
                {"next_action": "enter_mode", "enter_mode": "mode_1", "next_probe": "Problem Clarity",
                 "triggered_patterns": ["Solution in Disguise"], "requires_retrieval": false,
                 "micro_synthesis_due": true, "problem_domain": "logistics", "reasoning": "critical mass"}
                """);

        // When
        RoutingDecision decision = router.route("We need a dashboard for late shipments", new ConversationState("c1", 8));

        // Then
        assertThat(decision.isFallback()).isFalse();
        assertThat(decision.getNextAction()).isEqualTo(NextAction.ENTER_MODE);
        assertThat(decision.getEnterMode()).isEqualTo(AnalysisMode.MODE_1);
        assertThat(decision.getNextProbe()).isEqualTo("Problem Clarity");
        assertThat(decision.getTriggeredPatterns()).containsExactly("Solution in Disguise");
        assertThat(decision.isRequiresRetrieval()).isFalse();
        assertThat(decision.isMicroSynthesisDue()).isTrue();
        assertThat(decision.getProblemDomain()).isEqualTo("logistics");
    }

    @Test
    @DisplayName("Should send the router prompt as a JSON request with the probe catalogue")
    void testRoute_RequestShape() {
        // Given
        TurnRouter router = routerReplying("{\"next_action\": \"ask_questions\"}");

        // When
        router.route("hello", new ConversationState("c1", 8));

        // Then
        assertThat(requests).hasSize(1);
        GenerationRequest request = requests.get(0);
        assertThat(request.getCaller()).isEqualTo(GeminiConfig.CALLER_ROUTER);
        assertThat(request.isJsonOutput()).isTrue();
        assertThat(request.getTools()).isNullOrEmpty();
        String userPrompt = ((ContentBlock.Text) request.getMessages().get(0).blocks().get(0)).text();
        assertThat(userPrompt).contains("Problem Clarity").contains("hello");
    }

    @Test
    @DisplayName("Should strip markdown code fences around the JSON")
    void testParse_CodeFences() throws Exception {
        // Given
        TurnRouter router = routerReplying("");
        String fenced = "```json\n{\"next_action\": \"micro_synthesize\", \"suggested_probes\": \"Who Feels It\"}\n```";

        // When
        RoutingDecision decision = router.parse(fenced, "tell me more about the finance team");

        // Then
        assertThat(decision.getNextAction()).isEqualTo(NextAction.MICRO_SYNTHESIZE);
        assertThat(decision.getSuggestedProbes()).containsExactly("Who Feels It");
    }

    @Test
    @DisplayName("Should infer requires_retrieval from the message when the router leaves it out")
    void testParse_RetrievalInference() throws Exception {
        // Given
        TurnRouter router = routerReplying("");
        String json = "{\"next_action\": \"continue_mode\"}";

        // When / Then
        assertThat(router.parse(json, "yes, continue").isRequiresRetrieval()).isFalse();
        assertThat(router.parse(json, "What did the ops survey say about returns?").isRequiresRetrieval()).isTrue();
    }

    @Test
    @DisplayName("Should fall back to the conservative default on malformed output")
    void testRoute_MalformedOutput() {
        // Given
        ConversationState state = new ConversationState("c1", 8);

        // When
        RoutingDecision notJson = routerReplying("I think we should ask more questions").route("hi", state);
        RoutingDecision unknownAction = routerReplying("{\"next_action\": \"dance\"}").route("hi", state);
        RoutingDecision empty = routerReplying("   ").route("hi", state);

        // Then
        for (RoutingDecision decision : List.of(notJson, unknownAction, empty)) {
            assertThat(decision.isFallback()).isTrue();
            assertThat(decision.getNextAction()).isEqualTo(NextAction.ASK_QUESTIONS);
            assertThat(decision.isRequiresRetrieval()).isTrue();
            assertThat(decision.getNextProbe()).isNull();
        }
    }

    @Test
    @DisplayName("Should fall back to the conservative default when the router call fails")
    void testRoute_GenerationFailure() {
        // Given
        TurnRouter router = router(request -> {
            throw new GenerationException("gemini-2.5-flash", "timed out");
        });

        // When
        RoutingDecision decision = router.route("hi", new ConversationState("c1", 8));

        // Then
        assertThat(decision.isFallback()).isTrue();
        assertThat(decision.getReasoning()).contains("timed out");
    }

    @Test
    @DisplayName("Should treat a literal null probe as absent")
    void testParse_NullProbe() throws Exception {
        TurnRouter router = routerReplying("");

        RoutingDecision decision = router.parse("{\"next_action\": \"ask_questions\", \"next_probe\": \"null\"}", "ok");

        assertThat(decision.getNextProbe()).isNull();
        assertThat(decision.getEnterMode()).isNull();
    }

    @Test
    @DisplayName("Should recognise acknowledgement-only messages as filler")
    void testFillerDetector() {
        FillerMessageDetector detector = new FillerMessageDetector();

        assertThat(detector.isFiller("yes, continue")).isTrue();
        assertThat(detector.isFiller("Ok thanks!")).isTrue();
        assertThat(detector.isFiller("yes?")).isFalse();
        assertThat(detector.isFiller("yes, and the CFO owns the budget")).isFalse();
    }
}
