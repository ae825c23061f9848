package com.purchasingpower.forge.model.routing;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ConversationPhase {
    @JsonProperty("gathering") GATHERING,
    @JsonProperty("mode_active") MODE_ACTIVE
}
