package com.purchasingpower.forge.api;

import com.purchasingpower.forge.model.conversation.FileSummary;
import com.purchasingpower.forge.orchestrator.IngestionResult;
import com.purchasingpower.forge.orchestrator.TurnOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * Uploads and removes the documents of a conversation.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/conversations/{conversationId}/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final TurnOrchestrator orchestrator;

    /**
     * POST /api/v1/conversations/{id}/documents (multipart)
     *
     * <p>201 with the chunk count on success, 422 with a typed error when the document could not
     * be ingested. The raw file is stored either way.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentResponse> upload(@PathVariable String conversationId,
                                                   @RequestPart("file") MultipartFile file,
                                                   @RequestParam(value = "format", required = false) String format,
                                                   @RequestParam(value = "summary", required = false) String summary)
            throws IOException {
        String sourceId = file.getOriginalFilename();
        if (sourceId == null || sourceId.isBlank()) {
            return ResponseEntity.badRequest().body(DocumentResponse.builder()
                    .success(false)
                    .error("File name is required")
                    .build());
        }
        String declared = format != null && !format.isBlank() ? format : file.getContentType();
        IngestionResult result = orchestrator.ingestDocument(conversationId, sourceId, file.getBytes(), declared, summary);

        HttpStatus status = result.success() ? HttpStatus.CREATED : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(DocumentResponse.from(result));
    }

    /**
     * GET /api/v1/conversations/{id}/documents
     */
    @GetMapping
    public ResponseEntity<List<FileSummary>> list(@PathVariable String conversationId) {
        return ResponseEntity.ok(orchestrator.documents(conversationId));
    }

    /**
     * DELETE /api/v1/conversations/{id}/documents/{sourceId}
     */
    @DeleteMapping("/{sourceId}")
    public ResponseEntity<DocumentResponse> delete(@PathVariable String conversationId, @PathVariable String sourceId) {
        int removed = orchestrator.removeDocument(conversationId, sourceId);
        return ResponseEntity.ok(DocumentResponse.removed(sourceId, removed));
    }
}
