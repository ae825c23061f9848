package com.purchasingpower.forge.prompt;

import com.purchasingpower.forge.model.assumption.Assumption;
import com.purchasingpower.forge.model.assumption.AssumptionStatus;
import com.purchasingpower.forge.model.assumption.Confidence;
import com.purchasingpower.forge.model.assumption.Impact;
import com.purchasingpower.forge.model.conversation.ChatMessage;
import com.purchasingpower.forge.model.conversation.FileSummary;
import com.purchasingpower.forge.model.conversation.OrgContext;
import com.purchasingpower.forge.model.knowledge.GuidanceUnit;
import com.purchasingpower.forge.model.retrieval.ContextBundle;
import com.purchasingpower.forge.model.retrieval.RetrievedDocument;
import com.purchasingpower.forge.model.retrieval.RetrievedTurn;
import com.purchasingpower.forge.model.routing.GuidanceFiring;
import com.purchasingpower.forge.model.skeleton.FindingSkeleton;
import com.purchasingpower.forge.model.skeleton.RiskAssessment;
import com.purchasingpower.forge.model.skeleton.RiskDimension;
import com.purchasingpower.forge.model.skeleton.SolutionEvaluation;
import com.purchasingpower.forge.model.skeleton.Stakeholder;
import com.purchasingpower.forge.model.skeleton.SuccessMetrics;
import com.purchasingpower.forge.util.WireNames;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns structured state into the text blocks the prompt templates embed.
 */
@Component
public class PromptContextFormatter {

    static final String NO_ASSUMPTIONS = "No assumptions registered yet.";
    static final String EMPTY_SKELETON = "Finding skeleton is empty.";
    static final String NO_CONTEXT = "No project context available yet.";

    /**
     * Long user inputs are fenced so instructions inside them are read as content.
     */
    private static final int USER_CONTEXT_FENCE_CHARS = 500;

    /**
     * One line per assumption, high-impact guesses flagged. Used by the router.
     */
    public String assumptionSummary(List<Assumption> assumptions) {
        if (assumptions.isEmpty()) {
            return NO_ASSUMPTIONS;
        }
        return assumptions.stream()
                .map(a -> (isHighRiskGuess(a) ? "[!] " : "") + a.getId() + ": ["
                        + WireNames.of(a.getImpact()) + "/" + WireNames.of(a.getConfidence()) + "/"
                        + WireNames.of(a.getStatus()) + "] " + a.getClaim())
                .collect(Collectors.joining("\n"));
    }

    public String assumptionRegister(List<Assumption> assumptions) {
        if (assumptions.isEmpty()) {
            return NO_ASSUMPTIONS;
        }
        StringBuilder sb = new StringBuilder();
        for (Assumption a : assumptions) {
            sb.append("- **").append(a.getId()).append("** [").append(WireNames.of(a.getCategory())).append("] ")
                    .append(a.getClaim()).append('\n')
                    .append("  Impact: ").append(WireNames.of(a.getImpact()))
                    .append(" | Confidence: ").append(WireNames.of(a.getConfidence()))
                    .append(" | Status: ").append(WireNames.of(a.getStatus())).append('\n')
                    .append("  Basis: ").append(a.getBasis())
                    .append(" | Surfaced by: ").append(a.getSurfacedBy()).append('\n')
                    .append("  Depends on: ").append(a.getDependsOn().isEmpty() ? "none" : String.join(", ", a.getDependsOn()))
                    .append(" | Action: ").append(a.getRecommendedAction()).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    public String skeleton(FindingSkeleton skeleton) {
        List<String> parts = new ArrayList<>();
        if (hasText(skeleton.getProblemStatement())) {
            parts.add("Problem: " + skeleton.getProblemStatement());
        }
        if (hasText(skeleton.getTargetAudience())) {
            parts.add("Audience: " + skeleton.getTargetAudience());
        }
        if (!skeleton.getStakeholders().isEmpty()) {
            parts.add("Stakeholders:\n" + skeleton.getStakeholders().values().stream()
                    .map(this::stakeholderLine)
                    .collect(Collectors.joining("\n")));
        }
        SuccessMetrics metrics = skeleton.getSuccessMetrics();
        if (!metrics.isEmpty()) {
            parts.add("Metrics: Leading=" + orDash(metrics.getLeading()) + ", Lagging=" + orDash(metrics.getLagging())
                    + ", Anti=" + orDash(metrics.getAntiMetric()));
        }
        if (!skeleton.getDecisionCriteria().getProceedIf().isEmpty()) {
            parts.add("Proceed IF: " + String.join("; ", skeleton.getDecisionCriteria().getProceedIf()));
        }
        if (!skeleton.getDecisionCriteria().getDoNotProceedIf().isEmpty()) {
            parts.add("Do NOT proceed IF: " + String.join("; ", skeleton.getDecisionCriteria().getDoNotProceedIf()));
        }

        SolutionEvaluation evaluation = skeleton.getSolutionEvaluation();
        if (hasText(evaluation.getSolutionName())) {
            parts.add("Solution: " + evaluation.getSolutionName());
        }
        if (hasText(evaluation.getSolutionDescription())) {
            parts.add("Description: " + evaluation.getSolutionDescription());
        }
        if (hasText(evaluation.getBuildVsBuy())) {
            parts.add("Build vs buy: " + evaluation.getBuildVsBuy());
        }
        for (RiskDimension dimension : RiskDimension.values()) {
            RiskAssessment risk = evaluation.getRisk(dimension);
            if (risk != null) {
                parts.add(dimension.getDisplayName() + ": " + WireNames.of(risk.getLevel()) + " - " + risk.getSummary());
            }
        }
        if (evaluation.getValidationPlan() != null) {
            parts.add("Validation plan: " + WireNames.of(evaluation.getValidationPlan().getApproach())
                    + " for " + evaluation.getValidationPlan().getRiskiestAssumption());
        }
        if (evaluation.getGoNoGo() != null) {
            parts.add("Go/No-Go: " + WireNames.of(evaluation.getGoNoGo().getRecommendation()));
        }
        return parts.isEmpty() ? EMPTY_SKELETON : String.join("\n", parts);
    }

    public String projectContext(OrgContext org, List<FileSummary> fileSummaries) {
        List<String> parts = new ArrayList<>();
        if (!org.isEmpty()) {
            List<String> lines = new ArrayList<>();
            if (hasText(org.getCompany())) {
                lines.add(org.getCompany());
            }
            if (hasText(org.getLastEnrichedDomain())) {
                lines.add("Domain: " + org.getLastEnrichedDomain());
            }
            if (hasText(org.getPublicContext())) {
                lines.add(org.getPublicContext());
            }
            if (hasText(org.getInternalContext())) {
                lines.add(org.getInternalContext());
            }
            parts.add("## Organization Context\n" + String.join("\n", lines));
        }
        if (!fileSummaries.isEmpty()) {
            parts.add("## Available Documents\n" + fileSummaries.stream()
                    .map(f -> "- **" + f.getSourceId() + "**: " + f.getSummary())
                    .collect(Collectors.joining("\n")));
        }
        return parts.isEmpty() ? NO_CONTEXT : String.join("\n\n", parts);
    }

    public String messages(List<ChatMessage> messages) {
        return messages.stream()
                .map(m -> "**" + m.getRole().toUpperCase() + ":** "
                        + (m.isUser() ? fenceUserInput(m.getContent()) : m.getContent()))
                .collect(Collectors.joining("\n\n"));
    }

    /**
     * Plain "ROLE: text" lines, for the router's short window.
     */
    public String recentMessages(List<ChatMessage> messages) {
        if (messages.isEmpty()) {
            return "(no previous messages)";
        }
        return messages.stream()
                .map(m -> m.getRole().toUpperCase() + ": " + m.getContent())
                .collect(Collectors.joining("\n"));
    }

    public String firings(List<GuidanceFiring> firings) {
        if (firings.isEmpty()) {
            return "none";
        }
        return firings.stream()
                .map(f -> f.getName() + " (turn " + f.getTurn() + ")")
                .collect(Collectors.joining(", "));
    }

    /**
     * Guidance and retrieved sections of the bundle. Empty sections are left out entirely.
     */
    public String guidanceAndRetrieval(ContextBundle bundle) {
        StringBuilder sb = new StringBuilder();
        GuidanceUnit active = bundle.getActiveGuidance();
        if (active != null) {
            sb.append("\n\n## Active Probe\n").append(active.text());
        }
        if (!bundle.getTriggeredPatterns().isEmpty()) {
            sb.append("\n\n## Triggered Patterns\n").append(bundle.getTriggeredPatterns().stream()
                    .map(GuidanceUnit::text)
                    .collect(Collectors.joining("\n\n")));
        }
        if (!bundle.getDocuments().isEmpty()) {
            sb.append("\n\n## Retrieved Document Context\n").append(bundle.getDocuments().stream()
                    .map(this::document)
                    .collect(Collectors.joining("\n\n")));
        }
        if (!bundle.getConversationTurns().isEmpty()) {
            sb.append("\n\n## Earlier Relevant Exchanges\n").append(bundle.getConversationTurns().stream()
                    .map(this::turn)
                    .collect(Collectors.joining("\n\n")));
        }
        return sb.toString().strip();
    }

    private String document(RetrievedDocument document) {
        return document.contextHeader() + "\n" + document.parentText();
    }

    private String turn(RetrievedTurn turn) {
        String probe = hasText(turn.activeProbe()) ? " (Probe: " + turn.activeProbe() + ")" : "";
        return "Turn " + turn.turnNumber() + probe + ":\nUser: " + turn.userMessage()
                + "\nAssistant: " + turn.assistantResponse();
    }

    private String stakeholderLine(Stakeholder s) {
        return "  - " + s.getId() + " " + s.getName() + " (" + WireNames.of(s.getType()) + ")"
                + (s.isValidated() ? " [validated]" : "");
    }

    private String fenceUserInput(String content) {
        if (content != null && content.length() > USER_CONTEXT_FENCE_CHARS) {
            return "<user_context>\n" + content + "\n</user_context>";
        }
        return content;
    }

    private static boolean isHighRiskGuess(Assumption a) {
        return a.getImpact() == Impact.HIGH && a.getConfidence() == Confidence.GUESSED
                && a.getStatus() != AssumptionStatus.INVALIDATED;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String orDash(String value) {
        return hasText(value) ? value : "-";
    }
}
