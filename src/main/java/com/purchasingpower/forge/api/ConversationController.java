package com.purchasingpower.forge.api;

import com.purchasingpower.forge.model.conversation.ConversationSnapshot;
import com.purchasingpower.forge.orchestrator.TurnOrchestrator;
import com.purchasingpower.forge.orchestrator.TurnOutcome;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for conversations.
 *
 * <p>Turns run synchronously: the response carries the assistant's reply. Messages posted to the
 * same conversation while a turn is running wait for it.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final TurnOrchestrator orchestrator;

    /**
     * POST /api/v1/conversations
     */
    @PostMapping
    public ResponseEntity<ConversationCreatedResponse> create() {
        String conversationId = orchestrator.createConversation();
        return ResponseEntity.status(HttpStatus.CREATED).body(new ConversationCreatedResponse(conversationId));
    }

    /**
     * POST /api/v1/conversations/{id}/messages
     */
    @PostMapping("/{conversationId}/messages")
    public ResponseEntity<ChatResponse> message(@PathVariable String conversationId,
                                                @Valid @RequestBody ChatRequest request) {
        log.info("Message for conversation {}", conversationId);
        TurnOutcome outcome = orchestrator.handleMessage(conversationId, request.getMessage());
        return ResponseEntity.ok(ChatResponse.from(outcome));
    }

    /**
     * GET /api/v1/conversations/{id}/snapshot
     */
    @GetMapping("/{conversationId}/snapshot")
    public ResponseEntity<ConversationSnapshot> snapshot(@PathVariable String conversationId) {
        return ResponseEntity.ok(orchestrator.snapshot(conversationId));
    }

    /**
     * PUT /api/v1/conversations/{id}/snapshot
     */
    @PutMapping("/{conversationId}/snapshot")
    public ResponseEntity<Void> restore(@PathVariable String conversationId,
                                        @RequestBody ConversationSnapshot snapshot) {
        orchestrator.restore(conversationId, snapshot);
        return ResponseEntity.noContent().build();
    }
}
