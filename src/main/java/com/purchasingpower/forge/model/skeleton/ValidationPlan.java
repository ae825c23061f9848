package com.purchasingpower.forge.model.skeleton;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationPlan {
    private String riskiestAssumption;
    private ValidationApproach approach;
    private String description;
    private String timeline;
    private String successCriteria;
}
