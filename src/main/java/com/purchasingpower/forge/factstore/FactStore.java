package com.purchasingpower.forge.factstore;

import com.purchasingpower.forge.exception.AssumptionNotFoundException;
import com.purchasingpower.forge.model.assumption.Assumption;
import com.purchasingpower.forge.model.assumption.AssumptionCategory;
import com.purchasingpower.forge.model.assumption.AssumptionStatus;
import com.purchasingpower.forge.model.assumption.CascadeReport;
import com.purchasingpower.forge.model.assumption.Confidence;
import com.purchasingpower.forge.model.assumption.Impact;
import com.purchasingpower.forge.model.assumption.NewAssumption;
import com.purchasingpower.forge.model.skeleton.CriterionType;
import com.purchasingpower.forge.model.skeleton.FindingSkeleton;
import com.purchasingpower.forge.model.skeleton.GoNoGo;
import com.purchasingpower.forge.model.skeleton.RiskAssessment;
import com.purchasingpower.forge.model.skeleton.SolutionEvaluation;
import com.purchasingpower.forge.model.skeleton.Stakeholder;
import com.purchasingpower.forge.model.skeleton.StakeholderType;
import com.purchasingpower.forge.model.skeleton.SuccessMetrics;
import com.purchasingpower.forge.model.skeleton.ValidationPlan;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Assumption dependency graph plus the finding skeleton for one conversation.
 *
 * <p>All mutators are synchronized: the cascade walks several nodes and must see a consistent
 * graph. Every mutator is safe to re-apply. A mutation that references an unknown assumption id
 * throws {@link AssumptionNotFoundException} before anything is changed.
 *
 * <p>Cascade rules:
 * <ul>
 *   <li>invalidated: breadth-first over dependents, up to {@code cascadeDepth} hops, every
 *       active node becomes at_risk once and gets a note in its basis</li>
 *   <li>confirmed: direct dependents still at guessed confidence move to informed</li>
 * </ul>
 */
@Slf4j
public class FactStore {

    private static final Pattern ASSUMPTION_ID = Pattern.compile("^A\\d+$");

    private final int cascadeDepth;
    private final Map<String, Assumption> assumptions = new LinkedHashMap<>();
    private int assumptionCounter;
    private FindingSkeleton skeleton = new FindingSkeleton();

    public FactStore(int cascadeDepth) {
        if (cascadeDepth < 1) {
            throw new IllegalArgumentException("cascadeDepth must be positive");
        }
        this.cascadeDepth = cascadeDepth;
    }

    // ---------------------------------------------------------------- assumptions

    public synchronized RegistrationResult registerAssumption(NewAssumption input, int turn) {
        if (input.getClaim() == null || input.getClaim().isBlank()) {
            throw new IllegalArgumentException("claim is required");
        }
        Set<String> dependsOn = new LinkedHashSet<>(input.getDependsOn() == null ? List.of() : input.getDependsOn());
        for (String dependencyId : dependsOn) {
            require(dependencyId);
        }

        String key = normalizeClaim(input.getClaim());
        for (Assumption existing : assumptions.values()) {
            if (existing.getStatus() != AssumptionStatus.INVALIDATED && normalizeClaim(existing.getClaim()).equals(key)) {
                log.debug("Claim already registered as {}, skipping duplicate", existing.getId());
                return new RegistrationResult(existing.copy(), false);
            }
        }

        String id = "A" + (++assumptionCounter);
        Assumption assumption = Assumption.builder()
                .id(id)
                .claim(input.getClaim().trim())
                .category(input.getCategory())
                .impact(input.getImpact())
                .confidence(input.getConfidence())
                .status(AssumptionStatus.ACTIVE)
                .basis(input.getBasis())
                .surfacedBy(input.getSurfacedBy())
                .recommendedAction(input.getRecommendedAction() == null ? "" : input.getRecommendedAction())
                .impliedStakeholders(input.getImpliedStakeholders() == null
                        ? new ArrayList<>() : new ArrayList<>(input.getImpliedStakeholders()))
                .dependsOn(dependsOn)
                .createdTurn(turn)
                .lastUpdatedTurn(turn)
                .build();

        for (String dependencyId : dependsOn) {
            assumptions.get(dependencyId).getDependents().add(id);
        }
        assumptions.put(id, assumption);
        log.info("Registered assumption {} [{}/{}]", id, input.getImpact(), input.getConfidence());
        return new RegistrationResult(assumption.copy(), true);
    }

    public synchronized CascadeReport updateStatus(String id, AssumptionStatus newStatus, String reason, int turn) {
        Assumption target = require(id);
        AssumptionStatus previous = target.getStatus();
        if (previous == newStatus) {
            return CascadeReport.unchanged(id, previous);
        }

        target.setStatus(newStatus);
        target.setLastUpdatedTurn(turn);

        List<String> affected = switch (newStatus) {
            case INVALIDATED -> cascadeInvalidation(target, reason, turn);
            case CONFIRMED -> upgradeGuessedDependents(target, turn);
            default -> List.of();
        };
        log.info("Assumption {} {} -> {} ({} dependents affected)", id, previous, newStatus, affected.size());
        return new CascadeReport(id, previous, newStatus, true, affected);
    }

    /**
     * @return false when the assumption already had this confidence
     */
    public synchronized boolean updateConfidence(String id, Confidence newConfidence, String reason, int turn) {
        Assumption target = require(id);
        if (target.getConfidence() == newConfidence) {
            return false;
        }
        target.setConfidence(newConfidence);
        target.setLastUpdatedTurn(turn);
        log.debug("Assumption {} confidence -> {}: {}", id, newConfidence, reason);
        return true;
    }

    /**
     * Filtered copy of the register, in id order. Null filters match everything.
     */
    public synchronized List<Assumption> query(AssumptionStatus status, Impact impact, AssumptionCategory category) {
        return assumptions.values().stream()
                .filter(a -> status == null || a.getStatus() == status)
                .filter(a -> impact == null || a.getImpact() == impact)
                .filter(a -> category == null || a.getCategory() == category)
                .sorted(Comparator.comparingInt(a -> Integer.parseInt(a.getId().substring(1))))
                .map(Assumption::copy)
                .toList();
    }

    public synchronized List<Assumption> all() {
        return query(null, null, null);
    }

    public synchronized Optional<Assumption> find(String id) {
        return Optional.ofNullable(assumptions.get(id)).map(Assumption::copy);
    }

    private List<String> cascadeInvalidation(Assumption origin, String reason, int turn) {
        List<String> affected = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(origin.getId());

        Deque<Hop> queue = new ArrayDeque<>();
        for (String dependentId : origin.getDependents()) {
            queue.add(new Hop(dependentId, origin.getId(), 1));
        }

        while (!queue.isEmpty()) {
            Hop hop = queue.poll();
            if (!visited.add(hop.id())) {
                continue;
            }
            Assumption node = assumptions.get(hop.id());
            if (node == null) {
                continue;
            }
            if (node.getStatus() == AssumptionStatus.ACTIVE) {
                node.setStatus(AssumptionStatus.AT_RISK);
                node.setLastUpdatedTurn(turn);
                node.appendBasis(hop.depth() == 1
                        ? "Dependency " + origin.getId() + " was invalidated: " + reason
                        : "Upstream dependency " + origin.getId() + " was invalidated (via " + hop.via() + "): " + reason);
                affected.add(node.getId() + " flagged as at_risk");
            }
            if (hop.depth() < cascadeDepth) {
                for (String next : node.getDependents()) {
                    if (!visited.contains(next)) {
                        queue.add(new Hop(next, node.getId(), hop.depth() + 1));
                    }
                }
            }
        }
        return affected;
    }

    private List<String> upgradeGuessedDependents(Assumption origin, int turn) {
        List<String> affected = new ArrayList<>();
        for (String dependentId : origin.getDependents()) {
            Assumption dependent = assumptions.get(dependentId);
            if (dependent != null && dependent.getConfidence() == Confidence.GUESSED) {
                dependent.setConfidence(Confidence.INFORMED);
                dependent.setLastUpdatedTurn(turn);
                affected.add(dependentId + " confidence upgraded to informed");
            }
        }
        return affected;
    }

    private Assumption require(String id) {
        Assumption assumption = id == null ? null : assumptions.get(id.trim());
        if (assumption == null) {
            throw new AssumptionNotFoundException(id);
        }
        return assumption;
    }

    private static String normalizeClaim(String claim) {
        return claim.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private record Hop(String id, String via, int depth) {
    }

    // ---------------------------------------------------------------- skeleton

    /**
     * Live skeleton for rendering. Mutate only through the named operations below.
     */
    public synchronized FindingSkeleton getSkeleton() {
        return skeleton;
    }

    public synchronized void setProblemStatement(String text) {
        skeleton.setProblemStatement(text);
    }

    public synchronized void setTargetAudience(String text) {
        skeleton.setTargetAudience(text);
    }

    /**
     * Adds a stakeholder, or returns the existing one with the same name and type.
     */
    public synchronized Stakeholder addStakeholder(String name, StakeholderType type, boolean validated, String notes) {
        for (Stakeholder existing : skeleton.getStakeholders().values()) {
            if (existing.getType() == type && existing.getName().equalsIgnoreCase(name.trim())) {
                return existing;
            }
        }
        skeleton.setStakeholderCounter(skeleton.getStakeholderCounter() + 1);
        String id = "S" + skeleton.getStakeholderCounter();
        Stakeholder stakeholder = Stakeholder.builder()
                .id(id)
                .name(name.trim())
                .type(type)
                .validated(validated)
                .notes(notes == null ? "" : notes)
                .build();
        skeleton.getStakeholders().put(id, stakeholder);
        return stakeholder;
    }

    /**
     * Null arguments leave the corresponding metric untouched.
     */
    public synchronized void updateSuccessMetrics(String leading, String lagging, String antiMetric) {
        SuccessMetrics metrics = skeleton.getSuccessMetrics();
        if (leading != null) {
            metrics.setLeading(leading);
        }
        if (lagging != null) {
            metrics.setLagging(lagging);
        }
        if (antiMetric != null) {
            metrics.setAntiMetric(antiMetric);
        }
    }

    /**
     * @return false when the same condition was already recorded
     */
    public synchronized boolean addDecisionCriterion(CriterionType type, String condition) {
        List<String> list = skeleton.getDecisionCriteria().listFor(type);
        if (list.contains(condition)) {
            return false;
        }
        list.add(condition);
        return true;
    }

    public synchronized void setSolutionInfo(String name, String description, String buildVsBuy) {
        SolutionEvaluation evaluation = skeleton.getSolutionEvaluation();
        evaluation.setSolutionName(name);
        evaluation.setSolutionDescription(description);
        if (buildVsBuy != null && !buildVsBuy.isBlank()) {
            evaluation.setBuildVsBuy(buildVsBuy);
        }
    }

    public synchronized void setRiskAssessment(RiskAssessment assessment) {
        skeleton.getSolutionEvaluation().putRisk(assessment);
    }

    /**
     * The riskiest assumption may be an id or free text; ids must exist.
     */
    public synchronized void setValidationPlan(ValidationPlan plan) {
        String riskiest = plan.getRiskiestAssumption();
        if (riskiest != null && ASSUMPTION_ID.matcher(riskiest.trim()).matches()) {
            require(riskiest);
        }
        skeleton.getSolutionEvaluation().setValidationPlan(plan);
    }

    public synchronized void setGoNoGo(GoNoGo goNoGo) {
        skeleton.getSolutionEvaluation().setGoNoGo(goNoGo);
    }

    /**
     * Drops the solution-evaluation working fields. Problem framing and assumptions stay.
     */
    public synchronized void clearSolutionEvaluation() {
        skeleton.setSolutionEvaluation(new SolutionEvaluation());
    }

    // ---------------------------------------------------------------- snapshot

    public synchronized FactStoreSnapshot snapshot() {
        return FactStoreSnapshot.builder()
                .assumptions(all())
                .assumptionCounter(assumptionCounter)
                .skeleton(skeleton)
                .build();
    }

    /**
     * Rebuilds a store from a snapshot. Dependents are recomputed from dependsOn so the
     * inverse edges are consistent even if the saved data was edited by hand.
     */
    public static FactStore restore(FactStoreSnapshot snapshot, int cascadeDepth) {
        FactStore store = new FactStore(cascadeDepth);
        if (snapshot == null) {
            return store;
        }
        int highestId = 0;
        for (Assumption saved : snapshot.getAssumptions()) {
            Assumption copy = saved.copy();
            copy.getDependents().clear();
            store.assumptions.put(copy.getId(), copy);
            highestId = Math.max(highestId, Integer.parseInt(copy.getId().substring(1)));
        }
        for (Assumption assumption : store.assumptions.values()) {
            for (String dependencyId : assumption.getDependsOn()) {
                Assumption dependency = store.assumptions.get(dependencyId);
                if (dependency != null) {
                    dependency.getDependents().add(assumption.getId());
                }
            }
        }
        store.assumptionCounter = Math.max(snapshot.getAssumptionCounter(), highestId);
        if (snapshot.getSkeleton() != null) {
            store.skeleton = snapshot.getSkeleton();
        }
        return store;
    }
}
