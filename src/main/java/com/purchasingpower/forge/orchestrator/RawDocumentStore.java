package com.purchasingpower.forge.orchestrator;

import com.purchasingpower.forge.exception.StorageUnavailableException;
import com.purchasingpower.forge.workspace.WorkspaceLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Raw uploads under {@code conversations/<id>/documents}. Bytes are written before conversion
 * and stay on disk when conversion fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RawDocumentStore {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._ -]");

    private final WorkspaceLayout workspaceLayout;

    public Path store(String conversationId, String sourceId, byte[] content) {
        Path file = fileFor(conversationId, sourceId);
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, content);
            log.info("Saved raw document {} ({} bytes)", file.getFileName(), content.length);
            return file;
        } catch (IOException e) {
            throw new StorageUnavailableException(file.toString(), e);
        }
    }

    public boolean exists(String conversationId, String sourceId) {
        return Files.exists(fileFor(conversationId, sourceId));
    }

    public boolean delete(String conversationId, String sourceId) {
        Path file = fileFor(conversationId, sourceId);
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StorageUnavailableException(file.toString(), e);
        }
    }

    Path fileFor(String conversationId, String sourceId) {
        return workspaceLayout.documentsDir(conversationId).resolve(safeFileName(sourceId));
    }

    /**
     * Strips directory parts and characters that are unsafe in file names.
     */
    static String safeFileName(String sourceId) {
        String name = sourceId.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        name = UNSAFE.matcher(name).replaceAll("_");
        if (name.isBlank() || name.equals(".") || name.equals("..")) {
            return "document";
        }
        return name;
    }
}
