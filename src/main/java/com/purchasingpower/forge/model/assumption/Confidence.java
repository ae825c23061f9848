package com.purchasingpower.forge.model.assumption;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Confidence {
    @JsonProperty("validated") VALIDATED,
    @JsonProperty("informed") INFORMED,
    @JsonProperty("guessed") GUESSED
}
