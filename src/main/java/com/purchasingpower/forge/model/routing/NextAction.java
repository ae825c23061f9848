package com.purchasingpower.forge.model.routing;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum NextAction {
    @JsonProperty("ask_questions") ASK_QUESTIONS,
    @JsonProperty("micro_synthesize") MICRO_SYNTHESIZE,
    @JsonProperty("enter_mode") ENTER_MODE,
    @JsonProperty("continue_mode") CONTINUE_MODE,
    @JsonProperty("flag_conflict") FLAG_CONFLICT,
    @JsonProperty("complete_mode") COMPLETE_MODE
}
