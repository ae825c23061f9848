package com.purchasingpower.forge.model.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One probe or pattern that was used in a turn, with a free-text outcome note.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuidanceFiring {
    private String name;
    private String note;
    private int turn;
}
