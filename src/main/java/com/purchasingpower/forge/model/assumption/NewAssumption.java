package com.purchasingpower.forge.model.assumption;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Input for registering an assumption. Ids are assigned by the store.
 */
@Value
@Builder
public class NewAssumption {
    String claim;
    AssumptionCategory category;
    Impact impact;
    Confidence confidence;
    String basis;
    String surfacedBy;
    String recommendedAction;
    List<String> dependsOn;
    List<String> impliedStakeholders;
}
