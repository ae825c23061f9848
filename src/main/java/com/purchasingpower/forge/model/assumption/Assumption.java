package com.purchasingpower.forge.model.assumption;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A claim the analysis currently rests on, with its place in the dependency graph.
 *
 * <p>{@code dependents} is the inverse of {@code dependsOn} and is maintained by the
 * {@link com.purchasingpower.forge.factstore.FactStore}; callers never set it directly.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Assumption {

    private String id;
    private String claim;
    private AssumptionCategory category;
    private Impact impact;
    private Confidence confidence;
    private AssumptionStatus status;
    private String basis;
    private String surfacedBy;
    private String recommendedAction;

    @Builder.Default
    private List<String> impliedStakeholders = new ArrayList<>();

    @Builder.Default
    private Set<String> dependsOn = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> dependents = new LinkedHashSet<>();

    private int createdTurn;
    private int lastUpdatedTurn;

    /**
     * Deep copy, safe to hand out of the store.
     */
    public Assumption copy() {
        return toBuilder()
                .impliedStakeholders(new ArrayList<>(impliedStakeholders))
                .dependsOn(new LinkedHashSet<>(dependsOn))
                .dependents(new LinkedHashSet<>(dependents))
                .build();
    }

    public void appendBasis(String note) {
        basis = (basis == null || basis.isBlank()) ? note : basis + "\n" + note;
    }
}
