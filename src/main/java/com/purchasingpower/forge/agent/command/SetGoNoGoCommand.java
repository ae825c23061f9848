package com.purchasingpower.forge.agent.command;

import com.purchasingpower.forge.model.skeleton.GoNoGo;
import com.purchasingpower.forge.model.skeleton.GoNoGoRecommendation;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

public record SetGoNoGoCommand(
        @NotNull GoNoGoRecommendation recommendation,
        @NotNull List<String> conditions,
        @NotNull List<String> dealbreakers
) {

    public GoNoGo toGoNoGo() {
        return GoNoGo.builder()
                .recommendation(recommendation)
                .conditions(new ArrayList<>(conditions))
                .dealbreakers(new ArrayList<>(dealbreakers))
                .build();
    }
}
