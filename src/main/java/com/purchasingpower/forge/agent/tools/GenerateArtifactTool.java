package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.GenerateArtifactCommand;
import com.purchasingpower.forge.artifact.ArtifactRenderer;
import com.purchasingpower.forge.artifact.ArtifactRendering;
import com.purchasingpower.forge.exception.StorageUnavailableException;
import com.purchasingpower.forge.workspace.WorkspaceLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * Renders a brief for the user. The document goes into the visible response; the model only
 * hears that it was displayed. Incomplete skeletons get a warning back instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerateArtifactTool implements Tool {

    private final ToolCommandBinder binder;
    private final ArtifactRenderer artifactRenderer;
    private final WorkspaceLayout workspaceLayout;

    @Override
    public String getName() {
        return "generate_artifact";
    }

    @Override
    public String getDescription() {
        return "Render the problem brief (problem discovery) or the solution evaluation brief (solution "
                + "evaluation) from the current skeleton and assumption register. Populate the skeleton first.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "artifact_type": {"type": "string", "enum": ["problem_brief", "solution_evaluation_brief"]}
                  },
                  "required": ["artifact_type"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ARTIFACT;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        GenerateArtifactCommand command = binder.bind(getName(), parameters, GenerateArtifactCommand.class);
        ArtifactRendering rendering = artifactRenderer.render(command.artifactType(), context.getFactStore());
        if (!rendering.isComplete()) {
            return ToolResult.failure(rendering.warning());
        }

        context.getState().setLatestArtifact(rendering.document());
        context.recordMutation("artifact " + command.artifactType().getFileName());
        save(context.getState().getConversationId(), command.artifactType().getFileName(), rendering.document());
        return ToolResult.artifact(rendering.document());
    }

    private void save(String conversationId, String fileName, String document) {
        Path file = workspaceLayout.artifactsDir(conversationId).resolve(fileName);
        try {
            workspaceLayout.writeText(file, document);
        } catch (StorageUnavailableException e) {
            // The rendered brief is still shown and kept in the snapshot.
            log.warn("Could not save artifact to {}: {}", file, e.getCause().getMessage());
        }
    }
}
