package com.purchasingpower.forge.model.knowledge;

public enum GuidanceKind {
    PROBE,
    PATTERN
}
