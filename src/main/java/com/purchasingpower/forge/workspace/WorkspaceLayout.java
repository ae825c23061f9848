package com.purchasingpower.forge.workspace;

import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.exception.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Per-conversation directory layout under the workspace:
 * <pre>
 * conversations/&lt;id&gt;/
 *   vectors/      documents.json, conversations.json
 *   documents/    raw uploads, kept even when conversion fails
 *   artifacts/    latest rendered briefs
 *   context.md    organisation context
 *   snapshot.json
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkspaceLayout {

    private final AppProperties appProperties;

    public Path conversationDir(String conversationId) {
        return Path.of(appProperties.getWorkspaceDir(), "conversations", conversationId);
    }

    public Path vectorsDir(String conversationId) {
        return conversationDir(conversationId).resolve("vectors");
    }

    public Path documentsDir(String conversationId) {
        return conversationDir(conversationId).resolve("documents");
    }

    public Path artifactsDir(String conversationId) {
        return conversationDir(conversationId).resolve("artifacts");
    }

    public Path contextFile(String conversationId) {
        return conversationDir(conversationId).resolve("context.md");
    }

    public Path snapshotFile(String conversationId) {
        return conversationDir(conversationId).resolve("snapshot.json");
    }

    /**
     * Writes a UTF-8 text file, creating parent directories.
     *
     * @throws StorageUnavailableException if the file cannot be written
     */
    public void writeText(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} chars)", file, content.length());
        } catch (IOException e) {
            throw new StorageUnavailableException(file.toString(), e);
        }
    }
}
