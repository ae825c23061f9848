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
public class RiskAssessment {
    private RiskDimension dimension;
    private RiskLevel level;
    private String summary;

    @Builder.Default
    private List<String> evidenceFor = new ArrayList<>();

    @Builder.Default
    private List<String> evidenceAgainst = new ArrayList<>();
}
