package com.purchasingpower.forge.model.conversation;

import com.purchasingpower.forge.factstore.FactStoreSnapshot;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import com.purchasingpower.forge.model.routing.ConversationPhase;
import com.purchasingpower.forge.model.routing.RoutingContext;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Serialisable form of a conversation. Fields missing from a saved snapshot keep their defaults
 * on restore.
 */
@Data
public class ConversationSnapshot {

    public static final String SCHEMA_VERSION = "1.0";

    private String schemaVersion = SCHEMA_VERSION;
    private String conversationId;
    private String savedAt;
    private List<ChatMessage> messages = new ArrayList<>();
    private ConversationPhase phase;
    private AnalysisMode activeMode;
    private FactStoreSnapshot factStore;
    private RoutingContext routingContext;
    private OrgContext orgContext;
    private ProjectState projectState;
    private String latestArtifact;
}
