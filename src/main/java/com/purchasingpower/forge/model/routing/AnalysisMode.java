package com.purchasingpower.forge.model.routing;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Specialised analysis modes a conversation can enter from context gathering.
 */
public enum AnalysisMode {
    @JsonProperty("mode_1") MODE_1("Problem Discovery"),
    @JsonProperty("mode_2") MODE_2("Solution Evaluation");

    private final String displayName;

    AnalysisMode(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
