package com.purchasingpower.forge.model.assumption;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * High: if wrong, changes whether the work is pursued at all. Medium: changes the approach.
 * Low: refines details.
 */
public enum Impact {
    @JsonProperty("high") HIGH,
    @JsonProperty("medium") MEDIUM,
    @JsonProperty("low") LOW
}
