package com.purchasingpower.forge.model.assumption;

import com.purchasingpower.forge.util.WireNames;

import java.util.List;

/**
 * Outcome of a status change, including every node touched by the cascade.
 *
 * @param changed false when the assumption already had the requested status
 * @param affected human-readable lines, one per touched dependent
 */
public record CascadeReport(
        String assumptionId,
        AssumptionStatus previousStatus,
        AssumptionStatus newStatus,
        boolean changed,
        List<String> affected
) {

    public static CascadeReport unchanged(String assumptionId, AssumptionStatus status) {
        return new CascadeReport(assumptionId, status, status, false, List.of());
    }

    public String describe(String reason) {
        if (!changed) {
            return assumptionId + " already " + WireNames.of(newStatus) + ", nothing changed";
        }
        String text = "Updated " + assumptionId + " status to " + WireNames.of(newStatus) + ": " + reason;
        if (!affected.isEmpty()) {
            text += "\nCascade: " + String.join("; ", affected);
        }
        return text;
    }
}
