package com.purchasingpower.forge.vector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.vector.impl.InMemoryVectorIndex;
import com.purchasingpower.forge.workspace.WorkspaceLayout;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Opens the vector index of a conversation under {@code <workspace>/conversations/<id>/vectors}.
 */
@Component
@RequiredArgsConstructor
public class VectorIndexFactory {

    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;
    private final WorkspaceLayout workspaceLayout;

    public VectorIndex open(String conversationId) {
        if (!appProperties.getRetrieval().isPersistVectors()) {
            return new InMemoryVectorIndex(null, objectMapper);
        }
        return new InMemoryVectorIndex(workspaceLayout.vectorsDir(conversationId), objectMapper);
    }
}
