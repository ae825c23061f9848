package com.purchasingpower.forge.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.agent.impl.ToolContextImpl;
import com.purchasingpower.forge.client.generation.ContentBlock;
import com.purchasingpower.forge.client.generation.GenerationClient;
import com.purchasingpower.forge.client.generation.GenerationMessage;
import com.purchasingpower.forge.client.generation.GenerationRequest;
import com.purchasingpower.forge.client.generation.GenerationResponse;
import com.purchasingpower.forge.config.GeminiConfig;
import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.configuration.ConversationProperties;
import com.purchasingpower.forge.model.conversation.ChatMessage;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.prompt.PromptTemplate;
import com.purchasingpower.forge.model.retrieval.ContextBundle;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import com.purchasingpower.forge.model.routing.RoutingContext;
import com.purchasingpower.forge.model.routing.RoutingDecision;
import com.purchasingpower.forge.prompt.PromptContextFormatter;
import com.purchasingpower.forge.prompt.PromptLibraryService;
import com.purchasingpower.forge.util.WireNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The heavy call of a turn: a bounded generate / call-tools loop that produces the reply and
 * applies state changes through the {@link ToolDispatcher}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnExecutor {

    static final String GATHERING_TEMPLATE = "executor-gathering";
    static final String MODE_TEMPLATE = "executor-mode";

    static final String TRUNCATION_MARKER = "[...earlier conversation truncated for context length...]";
    static final String ERROR_TEXT =
            "I hit a temporary issue processing your message. Your conversation is preserved — please try again.";
    static final String PARTIAL_WARNING = "\n\n---\n⚠️ I encountered an error mid-response. What I've shared above "
            + "is still valid. Please try sending your next message and I'll continue.";
    static final String EMPTY_FALLBACK = "I processed your input but couldn't generate a visible response. "
            + "This usually means the analysis was very detailed — please try asking a follow-up question.";

    private final GenerationClient generationClient;
    private final ToolDispatcher toolDispatcher;
    private final PromptLibraryService promptLibrary;
    private final PromptContextFormatter formatter;
    private final GeminiConfig geminiConfig;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    /**
     * @param userMessage the current message; not yet part of {@code state.getMessages()}
     */
    public ExecutionResult execute(String userMessage, RoutingDecision decision, ContextBundle bundle,
                                   ConversationState state) {
        ConversationProperties props = appProperties.getConversation();
        String templateName = state.getActiveMode() == null ? GATHERING_TEMPLATE : MODE_TEMPLATE;
        log.info("Executing turn {} with {}", state.getCurrentTurn(), templateName);

        List<ChatMessage> history = new ArrayList<>(state.getMessages());
        history.add(ChatMessage.user(userMessage));

        Map<String, Object> variables = buildVariables(decision, bundle, state, history);
        String system = promptLibrary.renderSystem(templateName, variables);
        String prompt = promptLibrary.renderUser(templateName, variables);

        int estimated = (system.length() + prompt.length()) / 4;
        if (estimated > props.getPromptTokenLimit() && history.size() > props.getHistoryKeepRecent() + 2) {
            List<ChatMessage> truncated = truncate(history, props.getHistoryKeepRecent());
            log.warn("Prompt estimate {} tokens over {}, truncating history {} -> {} messages",
                    estimated, props.getPromptTokenLimit(), history.size(), truncated.size());
            variables.put("conversation", formatter.messages(truncated));
            prompt = promptLibrary.renderUser(templateName, variables);
        }

        PromptTemplate template = promptLibrary.getTemplate(templateName);
        int maxOutputTokens = template.getMaxOutputTokens() > 0
                ? template.getMaxOutputTokens()
                : props.getExecutorMaxOutputTokens();

        ToolContextImpl context = ToolContextImpl.create(state);
        return runLoop(system, prompt, maxOutputTokens, props.getMaxToolIterations(), context);
    }

    private ExecutionResult runLoop(String system, String prompt, int maxOutputTokens, int maxIterations,
                                    ToolContextImpl context) {
        List<GenerationMessage> conversation = new ArrayList<>();
        conversation.add(GenerationMessage.userText(prompt));

        StringBuilder text = new StringBuilder();
        String artifact = null;
        boolean failed = false;
        int iterations = 0;

        try {
            while (iterations < maxIterations) {
                iterations++;
                GenerationResponse response = generationClient.generate(GenerationRequest.builder()
                        .caller(GeminiConfig.CALLER_EXECUTOR)
                        .model(geminiConfig.getModelFor(GeminiConfig.CALLER_EXECUTOR))
                        .systemInstruction(system)
                        .messages(List.copyOf(conversation))
                        .tools(toolDispatcher.definitions())
                        .temperature(geminiConfig.getTemperatureFor(GeminiConfig.CALLER_EXECUTOR))
                        .maxOutputTokens(maxOutputTokens)
                        .timeout(geminiConfig.getTimeoutFor(GeminiConfig.CALLER_EXECUTOR))
                        .build());

                List<ContentBlock> results = new ArrayList<>();
                for (ContentBlock block : response.blocks()) {
                    if (block instanceof ContentBlock.Text) {
                        text.append(((ContentBlock.Text) block).text());
                    } else if (block instanceof ContentBlock.ToolCall) {
                        ContentBlock.ToolCall call = (ContentBlock.ToolCall) block;
                        ToolResult result = toolDispatcher.dispatch(call.name(), arguments(call.input()), context);
                        if (result.hasArtifact()) {
                            // Rendered documents go to the user verbatim; the model only gets the acknowledgement.
                            text.append("\n\n").append(result.getArtifact());
                            artifact = result.getArtifact();
                        }
                        results.add(new ContentBlock.ToolResult(
                                call.id(), call.name(), result.getMessage(), !result.isSuccess()));
                    }
                }

                if (results.isEmpty()) {
                    break;
                }
                conversation.add(new GenerationMessage(GenerationMessage.Role.MODEL, response.blocks()));
                conversation.add(new GenerationMessage(GenerationMessage.Role.USER, results));

                if (iterations == maxIterations) {
                    log.warn("Tool loop stopped after {} iterations with tool calls still pending", maxIterations);
                }
            }
        } catch (RuntimeException e) {
            failed = true;
            log.error("Executor failed after {} iterations ({} mutations applied)",
                    iterations, context.getMutations().size(), e);
            if (text.length() > 0) {
                text.append(PARTIAL_WARNING);
            } else {
                text.append(ERROR_TEXT);
            }
        }

        String responseText = text.toString();
        if (responseText.isBlank()) {
            log.warn("Executor returned no visible text after {} iterations", iterations);
            responseText = EMPTY_FALLBACK;
        }
        log.info("Executor finished: {} iterations, {} mutations, artifact={}, summaryUpdated={}",
                iterations, context.getMutations().size(), artifact != null, context.isSummaryUpdated());
        return new ExecutionResult(responseText, List.copyOf(context.getMutations()), artifact,
                context.isSummaryUpdated(), iterations, failed);
    }

    private Map<String, Object> buildVariables(RoutingDecision decision, ContextBundle bundle,
                                               ConversationState state, List<ChatMessage> history) {
        RoutingContext routing = state.getRoutingContext();
        AnalysisMode mode = state.getActiveMode();

        Map<String, Object> variables = new HashMap<>();
        variables.put("turnCount", state.getCurrentTurn());
        variables.put("firstTurn", state.getCurrentTurn() == 1);
        variables.put("firstModeTurn", routing.getModeTurnCount() == 0);
        variables.put("mode1", mode == AnalysisMode.MODE_1);
        variables.put("mode2", mode == AnalysisMode.MODE_2);
        variables.put("modeKey", WireNames.of(mode));
        variables.put("modeName", mode == null ? "Context Gathering" : mode.getDisplayName());
        variables.put("routingDecision", describeDecision(decision));
        variables.put("conversation", formatter.messages(history));
        variables.put("contextBlock", formatter.projectContext(bundle.getOrgContext(), bundle.getFileSummaries()));
        variables.put("assumptionRegister", formatter.assumptionRegister(bundle.getAssumptions()));
        variables.put("skeleton", formatter.skeleton(bundle.getSkeleton()));
        variables.put("guidance", formatter.guidanceAndRetrieval(bundle));
        variables.put("probesFired", formatter.firings(routing.getProbesFired()));
        variables.put("patternsFired", formatter.firings(routing.getPatternsFired()));
        variables.put("conversationSummary", routing.getConversationSummary());
        variables.put("enrichmentNeeded", decision.isEnrichmentNeeded());
        variables.put("enrichmentQuery", decision.getEnrichmentQuery() == null ? "" : decision.getEnrichmentQuery());
        variables.put("retrievalDegraded", bundle.isRetrievalDegraded());
        return variables;
    }

    /**
     * The decision as snake_case JSON, the same shape the router produced.
     */
    String describeDecision(RoutingDecision decision) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("next_action", WireNames.of(decision.getNextAction()));
        view.put("enter_mode", decision.getEnterMode() == null ? null : WireNames.of(decision.getEnterMode()));
        view.put("next_probe", decision.getNextProbe());
        view.put("triggered_patterns", decision.getTriggeredPatterns());
        view.put("reasoning", decision.getReasoning());
        view.put("conflict_flags", decision.getConflictFlags());
        view.put("high_risk_unprobed", decision.getHighRiskUnprobed());
        view.put("suggested_probes", decision.getSuggestedProbes());
        view.put("micro_synthesis_due", decision.isMicroSynthesisDue());
        view.put("enrichment_needed", decision.isEnrichmentNeeded());
        view.put("enrichment_query", decision.getEnrichmentQuery());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Routing decision could not be serialised", e);
        }
    }

    static List<ChatMessage> truncate(List<ChatMessage> history, int keepRecent) {
        List<ChatMessage> truncated = new ArrayList<>(keepRecent + 2);
        truncated.add(history.get(0));
        truncated.add(ChatMessage.assistant(TRUNCATION_MARKER));
        truncated.addAll(history.subList(history.size() - keepRecent, history.size()));
        return truncated;
    }

    private Map<String, Object> arguments(JsonNode input) {
        if (input == null || !input.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(input, new TypeReference<Map<String, Object>>() {
        });
    }
}
