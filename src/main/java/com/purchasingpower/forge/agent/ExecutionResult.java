package com.purchasingpower.forge.agent;

import java.util.List;

/**
 * Outcome of one executor run.
 *
 * @param responseText user-visible text, never blank
 * @param mutationsApplied one entry per successful state change, in order
 * @param artifact last rendered artifact of the turn, or null
 * @param summaryUpdated whether the rolling summary was written this turn
 * @param failed true when the generation loop ended on an error
 */
public record ExecutionResult(
        String responseText,
        List<String> mutationsApplied,
        String artifact,
        boolean summaryUpdated,
        int iterations,
        boolean failed
) {
}
