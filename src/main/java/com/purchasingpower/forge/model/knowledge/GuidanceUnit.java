package com.purchasingpower.forge.model.knowledge;

import com.purchasingpower.forge.model.routing.AnalysisMode;

/**
 * A unit of domain guidance addressed by key. {@code key} is the canonical catalogue key,
 * whatever spelling was used to look it up.
 */
public record GuidanceUnit(GuidanceKind kind, String key, AnalysisMode mode, String text) {
}
