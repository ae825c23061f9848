package com.purchasingpower.forge.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.client.generation.GenerationClient;
import com.purchasingpower.forge.client.generation.GenerationMessage;
import com.purchasingpower.forge.client.generation.GenerationRequest;
import com.purchasingpower.forge.client.generation.GenerationResponse;
import com.purchasingpower.forge.config.GeminiConfig;
import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.exception.GenerationException;
import com.purchasingpower.forge.knowledge.KnowledgeIndex;
import com.purchasingpower.forge.model.conversation.ChatMessage;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.knowledge.GuidanceKind;
import com.purchasingpower.forge.model.prompt.PromptTemplate;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import com.purchasingpower.forge.model.routing.NextAction;
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
import java.util.List;
import java.util.Map;

/**
 * Cheap routing call made before every turn.
 *
 * <p>Sees a concise view of state (assumption summary, rolling summary, the last exchanges and the
 * guidance key catalogue), never the full register or retrieved content. Any failure yields the
 * conservative default so the turn always proceeds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnRouter {

    static final String TEMPLATE = "router";

    private final GenerationClient generationClient;
    private final PromptLibraryService promptLibrary;
    private final PromptContextFormatter formatter;
    private final KnowledgeIndex knowledgeIndex;
    private final FillerMessageDetector fillerDetector;
    private final GeminiConfig geminiConfig;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    public RoutingDecision route(String userMessage, ConversationState state) {
        Map<String, Object> variables = buildVariables(userMessage, state);
        PromptTemplate template = promptLibrary.getTemplate(TEMPLATE);

        GenerationRequest request = GenerationRequest.builder()
                .caller(GeminiConfig.CALLER_ROUTER)
                .model(geminiConfig.getModelFor(GeminiConfig.CALLER_ROUTER))
                .systemInstruction(promptLibrary.renderSystem(TEMPLATE, variables))
                .messages(List.of(GenerationMessage.userText(promptLibrary.renderUser(TEMPLATE, variables))))
                .temperature(geminiConfig.getTemperatureFor(GeminiConfig.CALLER_ROUTER))
                .maxOutputTokens(template.getMaxOutputTokens() > 0
                        ? template.getMaxOutputTokens()
                        : appProperties.getConversation().getRouterMaxOutputTokens())
                .timeout(geminiConfig.getTimeoutFor(GeminiConfig.CALLER_ROUTER))
                .jsonOutput(true)
                .build();

        try {
            GenerationResponse response = generationClient.generate(request);
            RoutingDecision decision = parse(response.text(), userMessage);
            log.info("Routing decision: {} (probe={}, retrieval={}, enterMode={})",
                    WireNames.of(decision.getNextAction()), decision.getNextProbe(),
                    decision.isRequiresRetrieval(), WireNames.of(decision.getEnterMode()));
            return decision;
        } catch (GenerationException e) {
            log.warn("Router call failed, using conservative default: {}", e.getMessage());
            return RoutingDecision.conservativeDefault("Router call failed: " + e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Router output is not valid JSON, using conservative default: {}", e.getOriginalMessage());
            return RoutingDecision.conservativeDefault("Router output could not be parsed");
        } catch (RuntimeException e) {
            log.warn("Router output unusable, using conservative default: {}", e.getMessage());
            return RoutingDecision.conservativeDefault("Router output unusable: " + e.getMessage());
        }
    }

    /**
     * Lenient parse: code fences are stripped, unknown keys ignored, a single string accepted
     * where a list is expected. A missing or unknown next_action makes the output unusable.
     */
    RoutingDecision parse(String raw, String userMessage) throws JsonProcessingException {
        String json = stripFences(raw);
        if (json.isEmpty()) {
            throw new IllegalArgumentException("empty router output");
        }
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("router output is not a JSON object");
        }

        NextAction nextAction = WireNames.parse(NextAction.class, text(root, "next_action"));
        if (nextAction == null) {
            throw new IllegalArgumentException("unknown next_action '" + text(root, "next_action") + "'");
        }

        JsonNode retrievalNode = root.get("requires_retrieval");
        boolean requiresRetrieval = retrievalNode != null && retrievalNode.isBoolean()
                ? retrievalNode.asBoolean()
                : !fillerDetector.isFiller(userMessage);

        return RoutingDecision.builder()
                .nextAction(nextAction)
                .enterMode(WireNames.parse(AnalysisMode.class, text(root, "enter_mode")))
                .nextProbe(blankToNull(text(root, "next_probe")))
                .triggeredPatterns(strings(root, "triggered_patterns"))
                .requiresRetrieval(requiresRetrieval)
                .conflictFlags(strings(root, "conflict_flags"))
                .highRiskUnprobed(strings(root, "high_risk_unprobed"))
                .suggestedProbes(strings(root, "suggested_probes"))
                .microSynthesisDue(root.path("micro_synthesis_due").asBoolean(false))
                .enrichmentNeeded(root.path("enrichment_needed").asBoolean(false))
                .enrichmentQuery(blankToNull(text(root, "enrichment_query")))
                .problemDomain(blankToNull(text(root, "problem_domain")))
                .reasoning(text(root, "reasoning"))
                .build();
    }

    private Map<String, Object> buildVariables(String userMessage, ConversationState state) {
        RoutingContext routing = state.getRoutingContext();
        int window = appProperties.getRetrieval().getAlwaysOnWindow();
        AnalysisMode mode = state.getActiveMode();

        Map<String, Object> variables = new HashMap<>();
        variables.put("userMessage", userMessage);
        variables.put("originalInput", firstUserMessage(state.getMessages(), userMessage));
        variables.put("conversationSummary", routing.getConversationSummary().isBlank()
                ? "(No summary yet, first turn)" : routing.getConversationSummary());
        variables.put("turnCount", state.getCurrentTurn());
        variables.put("phase", WireNames.of(state.getPhase()));
        variables.put("activeMode", mode == null ? "none" : WireNames.of(mode));
        variables.put("probesFired", formatter.firings(routing.getProbesFired()));
        variables.put("patternsFired", formatter.firings(routing.getPatternsFired()));
        variables.put("microSynthesisDue", routing.isMicroSynthesisDue());
        variables.put("criticalMassReached", routing.isCriticalMassReached());
        variables.put("orgDomain", state.getOrgContext().getLastEnrichedDomain());
        variables.put("enrichmentCount", state.getOrgContext().getEnrichmentCount());
        variables.put("maxEnrichments", appProperties.getConversation().getMaxEnrichments());
        variables.put("assumptionSummary", formatter.assumptionSummary(state.getFactStore().all()));
        variables.put("recentMessages", formatter.recentMessages(state.recentExchanges(window)));
        variables.put("probeKeys", knowledgeIndex.keys(GuidanceKind.PROBE, mode));
        variables.put("patternKeys", knowledgeIndex.keys(GuidanceKind.PATTERN, mode));
        return variables;
    }

    private static String firstUserMessage(List<ChatMessage> messages, String fallback) {
        return messages.stream().filter(ChatMessage::isUser).map(ChatMessage::getContent).findFirst().orElse(fallback);
    }

    static String stripFences(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.strip();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
            int closing = text.lastIndexOf("```");
            if (closing >= 0) {
                text = text.substring(0, closing);
            }
        }
        return text.strip();
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static List<String> strings(JsonNode root, String field) {
        JsonNode node = root.get(field);
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            node.forEach(item -> {
                if (!item.isNull() && !item.asText().isBlank()) {
                    values.add(item.asText());
                }
            });
        } else if (!node.asText().isBlank()) {
            values.add(node.asText());
        }
        return values;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() || value.equalsIgnoreCase("null") ? null : value;
    }
}
