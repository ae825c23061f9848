package com.purchasingpower.forge.knowledge;

import com.purchasingpower.forge.model.knowledge.GuidanceKind;
import com.purchasingpower.forge.model.knowledge.GuidanceUnit;
import com.purchasingpower.forge.model.routing.AnalysisMode;

import java.util.List;
import java.util.Optional;

/**
 * Static keyed lookup of probes and patterns. Never searched semantically.
 */
public interface KnowledgeIndex {

    /**
     * Resolve a key exactly, or after normalisation (case, quotes, a leading
     * "Probe N:" label).
     */
    Optional<GuidanceUnit> lookup(GuidanceKind kind, String key);

    /**
     * Canonical keys of one kind, in catalogue order. A null mode returns every mode's keys.
     */
    List<String> keys(GuidanceKind kind, AnalysisMode mode);
}
