package com.purchasingpower.forge.orchestrator;

import com.purchasingpower.forge.client.generation.GenerationClient;
import com.purchasingpower.forge.client.generation.GenerationMessage;
import com.purchasingpower.forge.client.generation.GenerationRequest;
import com.purchasingpower.forge.config.GeminiConfig;
import com.purchasingpower.forge.exception.GenerationException;
import com.purchasingpower.forge.model.assumption.Assumption;
import com.purchasingpower.forge.model.assumption.AssumptionStatus;
import com.purchasingpower.forge.model.conversation.ConversationState;
import com.purchasingpower.forge.model.prompt.PromptTemplate;
import com.purchasingpower.forge.model.routing.GuidanceFiring;
import com.purchasingpower.forge.model.skeleton.FindingSkeleton;
import com.purchasingpower.forge.model.skeleton.Stakeholder;
import com.purchasingpower.forge.prompt.PromptLibraryService;
import com.purchasingpower.forge.util.WireNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Short summaries made by the summary model: one per indexed turn and one per uploaded file.
 * Both fall back to text built locally when the model fails or answers with something unusable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SummaryService {

    static final String TURN_TEMPLATE = "turn-summary";
    static final String FILE_TEMPLATE = "file-summary";

    static final int TURN_INPUT_CHARS = 1000;
    static final int FILE_INPUT_CHARS = 3000;
    static final int MAX_TURN_SUMMARY_CHARS = 600;
    static final int PREVIEW_CHARS = 300;

    private static final List<String> REFUSAL_PREFIXES = List.of(
            "i'm sorry", "i am sorry", "i cannot", "i can't", "as an ai", "i'm unable", "i am unable");

    private final GenerationClient generationClient;
    private final PromptLibraryService promptLibrary;
    private final GeminiConfig geminiConfig;

    /**
     * One or two sentences describing the exchange, used as the embedded text of the turn.
     */
    public String summarizeTurn(int turnNumber, String userMessage, String assistantResponse) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("userMessage", head(userMessage, TURN_INPUT_CHARS));
        variables.put("assistantResponse", head(assistantResponse, TURN_INPUT_CHARS));

        try {
            String summary = generate(TURN_TEMPLATE, GeminiConfig.CALLER_TURN_SUMMARY, variables);
            if (isUsableTurnSummary(summary)) {
                return summary.strip();
            }
            log.warn("Turn {} summary rejected, using synthesised summary: '{}'", turnNumber, head(summary, 80));
        } catch (GenerationException e) {
            log.warn("Turn {} summary call failed, using synthesised summary: {}", turnNumber, e.getMessage());
        }
        return synthesizeTurnSummary(turnNumber, userMessage, assistantResponse);
    }

    /**
     * One paragraph on what the document covers. Falls back to a preview of its text.
     */
    public String summarizeFile(String sourceId, String markdown) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("filename", sourceId);
        variables.put("content", head(markdown, FILE_INPUT_CHARS));

        try {
            String summary = generate(FILE_TEMPLATE, GeminiConfig.CALLER_FILE_SUMMARY, variables);
            if (summary != null && !summary.isBlank()) {
                return summary.strip();
            }
            log.warn("Empty summary for {}, using text preview", sourceId);
        } catch (GenerationException e) {
            log.warn("File summary for {} failed, using text preview: {}", sourceId, e.getMessage());
        }
        return preview(markdown);
    }

    /**
     * Rolling summary rebuilt from structured state, used when a turn ended without the
     * executor updating it.
     */
    public String synthesizeRollingSummary(ConversationState state) {
        FindingSkeleton skeleton = state.getFactStore().getSkeleton();
        List<Assumption> assumptions = state.getFactStore().all();
        StringBuilder text = new StringBuilder();

        text.append("Turn ").append(state.getCurrentTurn()).append(", phase ").append(WireNames.of(state.getPhase()));
        if (state.getActiveMode() != null) {
            text.append(" (").append(state.getActiveMode().getDisplayName()).append(")");
        }
        text.append(". ");

        if (skeleton.getProblemStatement() != null && !skeleton.getProblemStatement().isBlank()) {
            text.append("Problem: ").append(skeleton.getProblemStatement().strip()).append(". ");
        }
        if (!skeleton.getStakeholders().isEmpty()) {
            text.append("Stakeholders: ")
                    .append(skeleton.getStakeholders().values().stream().map(Stakeholder::getName)
                            .collect(Collectors.joining(", ")))
                    .append(". ");
        }
        if (!assumptions.isEmpty()) {
            long atRisk = assumptions.stream().filter(a -> a.getStatus() == AssumptionStatus.AT_RISK).count();
            long invalidated = assumptions.stream().filter(a -> a.getStatus() == AssumptionStatus.INVALIDATED).count();
            text.append(assumptions.size()).append(" assumptions registered (")
                    .append(atRisk).append(" at risk, ").append(invalidated).append(" invalidated). ");
        }
        List<GuidanceFiring> probes = state.getRoutingContext().getProbesFired();
        if (!probes.isEmpty()) {
            text.append("Probes used: ")
                    .append(probes.stream().map(GuidanceFiring::getName).distinct().collect(Collectors.joining(", ")))
                    .append(".");
        }
        return text.toString().strip();
    }

    static boolean isUsableTurnSummary(String summary) {
        if (summary == null || summary.isBlank()) {
            return false;
        }
        String normalized = summary.strip().toLowerCase(Locale.ROOT);
        if (normalized.length() > MAX_TURN_SUMMARY_CHARS) {
            return false;
        }
        return REFUSAL_PREFIXES.stream().noneMatch(normalized::startsWith);
    }

    static String synthesizeTurnSummary(int turnNumber, String userMessage, String assistantResponse) {
        return "Turn " + turnNumber + ": user said \"" + oneLine(head(userMessage, 200))
                + "\"; assistant replied \"" + oneLine(head(assistantResponse, 200)) + "\"";
    }

    private String generate(String templateName, String caller, Map<String, Object> variables) {
        PromptTemplate template = promptLibrary.getTemplate(templateName);
        GenerationRequest request = GenerationRequest.builder()
                .caller(caller)
                .model(geminiConfig.getModelFor(caller))
                .systemInstruction(promptLibrary.renderSystem(templateName, variables))
                .messages(List.of(GenerationMessage.userText(promptLibrary.renderUser(templateName, variables))))
                .temperature(geminiConfig.getTemperatureFor(caller))
                .maxOutputTokens(template.getMaxOutputTokens())
                .timeout(geminiConfig.getTimeoutFor(caller))
                .build();
        return generationClient.generate(request).text();
    }

    private static String preview(String markdown) {
        String text = oneLine(markdown == null ? "" : markdown);
        return text.length() <= PREVIEW_CHARS ? text : text.substring(0, PREVIEW_CHARS) + "...";
    }

    private static String head(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }

    private static String oneLine(String text) {
        return text.replaceAll("\\s+", " ").strip();
    }
}
