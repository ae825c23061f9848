package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.UpdateOrgContextCommand;
import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.exception.StorageUnavailableException;
import com.purchasingpower.forge.model.conversation.OrgContext;
import com.purchasingpower.forge.workspace.WorkspaceLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * Appends organisation context. Public (researched) context counts against the enrichment
 * cap; internal context supplied by the user is always kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UpdateOrgContextTool implements Tool {

    private final ToolCommandBinder binder;
    private final AppProperties appProperties;
    private final WorkspaceLayout workspaceLayout;

    @Override
    public String getName() {
        return "update_org_context";
    }

    @Override
    public String getDescription() {
        return "Add what is known about the user's organisation: public context about the company and "
                + "its domain, and internal context the user shared. Text is appended, never replaced.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "company": {"type": "string"},
                    "public_context": {"type": "string", "description": "Public facts about the company and its market"},
                    "internal_context": {"type": "string", "description": "Internal facts the user shared"},
                    "domain": {"type": "string", "description": "Problem domain this context was gathered for"}
                  },
                  "required": ["company", "domain"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.CONTEXT;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        UpdateOrgContextCommand command = binder.bind(getName(), parameters, UpdateOrgContextCommand.class);
        OrgContext org = context.getState().getOrgContext();
        int max = appProperties.getConversation().getMaxEnrichments();

        boolean publicAccepted = false;
        if (hasText(command.publicContext())) {
            if (org.getEnrichmentCount() < max) {
                org.setPublicContext(append(org.getPublicContext(), command.publicContext()));
                org.setEnrichmentCount(org.getEnrichmentCount() + 1);
                publicAccepted = true;
            } else {
                log.info("Enrichment cap {} reached, public context for '{}' dropped", max, command.domain());
            }
        }
        if (hasText(command.internalContext())) {
            org.setInternalContext(append(org.getInternalContext(), command.internalContext()));
        }
        org.setCompany(command.company().trim());
        org.setLastEnrichedDomain(command.domain().trim());

        context.recordMutation("org context");
        writeContextFile(context.getState().getConversationId(), org);

        String result = "Org context updated for " + org.getCompany() + " / " + org.getLastEnrichedDomain();
        if (hasText(command.publicContext()) && !publicAccepted) {
            result += " (public context not added: enrichment limit of " + max + " reached)";
        }
        return ToolResult.success(result);
    }

    private void writeContextFile(String conversationId, OrgContext org) {
        StringBuilder text = new StringBuilder("# Organization Context\n\n");
        text.append("**Company:** ").append(org.getCompany()).append("\n");
        text.append("**Domain:** ").append(org.getLastEnrichedDomain()).append("\n");
        if (hasText(org.getPublicContext())) {
            text.append("\n## Public Context\n\n").append(org.getPublicContext()).append("\n");
        }
        if (hasText(org.getInternalContext())) {
            text.append("\n## Internal Context\n\n").append(org.getInternalContext()).append("\n");
        }

        Path file = workspaceLayout.contextFile(conversationId);
        try {
            workspaceLayout.writeText(file, text.toString());
        } catch (StorageUnavailableException e) {
            log.warn("Could not write {}: {}", file, e.getCause().getMessage());
        }
    }

    private static String append(String existing, String addition) {
        String trimmed = addition.trim();
        return hasText(existing) ? existing + "\n\n" + trimmed : trimmed;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
