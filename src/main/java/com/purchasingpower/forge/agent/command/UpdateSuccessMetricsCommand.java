package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Absent fields leave the stored value untouched.
 */
public record UpdateSuccessMetricsCommand(
        String leading,
        String lagging,
        @JsonProperty("anti_metric") String antiMetric
) {

    public boolean isEmpty() {
        return leading == null && lagging == null && antiMetric == null;
    }
}
