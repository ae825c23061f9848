package com.purchasingpower.forge.model.skeleton;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GoNoGo {
    private GoNoGoRecommendation recommendation;

    @Builder.Default
    private List<String> conditions = new ArrayList<>();

    @Builder.Default
    private List<String> dealbreakers = new ArrayList<>();
}
