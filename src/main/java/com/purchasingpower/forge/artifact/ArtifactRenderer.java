package com.purchasingpower.forge.artifact;

import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.forge.factstore.FactStore;
import com.purchasingpower.forge.model.assumption.Assumption;
import com.purchasingpower.forge.model.assumption.AssumptionStatus;
import com.purchasingpower.forge.model.skeleton.DecisionCriteria;
import com.purchasingpower.forge.model.skeleton.FindingSkeleton;
import com.purchasingpower.forge.model.skeleton.GoNoGo;
import com.purchasingpower.forge.model.skeleton.RiskAssessment;
import com.purchasingpower.forge.model.skeleton.RiskDimension;
import com.purchasingpower.forge.model.skeleton.SolutionEvaluation;
import com.purchasingpower.forge.model.skeleton.SuccessMetrics;
import com.purchasingpower.forge.model.skeleton.ValidationPlan;
import com.purchasingpower.forge.prompt.PlainTextMustacheFactory;
import com.purchasingpower.forge.util.WireNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the work products from the skeleton and the assumption register using the
 * Mustache templates under {@code artifacts/}.
 */
@Slf4j
@Component
public class ArtifactRenderer {

    private static final String NOT_DEFINED = "_Not yet defined_";

    private final MustacheFactory mustacheFactory = new PlainTextMustacheFactory("artifacts");
    private final Map<ArtifactType, Mustache> templates = new EnumMap<>(ArtifactType.class);

    public ArtifactRenderer() {
        for (ArtifactType type : ArtifactType.values()) {
            templates.put(type, mustacheFactory.compile(type.getTemplate()));
        }
    }

    public ArtifactRendering render(ArtifactType type, FactStore factStore) {
        FindingSkeleton skeleton = factStore.getSkeleton();
        List<Assumption> open = openAssumptions(factStore);

        List<String> missing = type == ArtifactType.PROBLEM_BRIEF
                ? missingForProblemBrief(skeleton)
                : missingForSolutionEvaluation(skeleton.getSolutionEvaluation());
        if (!missing.isEmpty()) {
            log.info("Artifact {} not rendered, empty fields: {}", type, missing);
            return ArtifactRendering.incomplete(type, missing);
        }

        Map<String, Object> view = type == ArtifactType.PROBLEM_BRIEF
                ? problemBriefView(skeleton, open)
                : solutionEvaluationView(skeleton, open);

        StringWriter writer = new StringWriter();
        templates.get(type).execute(writer, view);
        log.info("Rendered {} ({} chars)", type, writer.getBuffer().length());
        return ArtifactRendering.rendered(type, writer.toString());
    }

    private static List<Assumption> openAssumptions(FactStore factStore) {
        List<Assumption> open = new ArrayList<>();
        for (Assumption assumption : factStore.all()) {
            if (assumption.getStatus() == AssumptionStatus.ACTIVE || assumption.getStatus() == AssumptionStatus.AT_RISK) {
                open.add(assumption);
            }
        }
        return open;
    }

    private static List<String> missingForProblemBrief(FindingSkeleton skeleton) {
        List<String> missing = new ArrayList<>();
        if (isBlank(skeleton.getProblemStatement())) {
            missing.add("problem_statement");
        }
        if (skeleton.getStakeholders().isEmpty()) {
            missing.add("stakeholders");
        }
        if (skeleton.getSuccessMetrics().isEmpty()) {
            missing.add("success_metrics");
        }
        if (skeleton.getDecisionCriteria().isEmpty()) {
            missing.add("decision_criteria");
        }
        return missing;
    }

    private static List<String> missingForSolutionEvaluation(SolutionEvaluation evaluation) {
        List<String> missing = new ArrayList<>();
        if (isBlank(evaluation.getSolutionName())) {
            missing.add("solution_name");
        }
        if (evaluation.getValueRisk() == null) {
            missing.add("value_risk_level");
        }
        if (evaluation.getGoNoGo() == null || evaluation.getGoNoGo().getRecommendation() == null) {
            missing.add("go_no_go_recommendation");
        }
        return missing;
    }

    private static Map<String, Object> problemBriefView(FindingSkeleton skeleton, List<Assumption> open) {
        Map<String, Object> view = new HashMap<>();
        view.put("problemStatement", orDefault(skeleton.getProblemStatement(), NOT_DEFINED));
        view.put("targetAudience", orDefault(skeleton.getTargetAudience(), NOT_DEFINED));

        List<Map<String, Object>> stakeholders = new ArrayList<>();
        skeleton.getStakeholders().values().forEach(s -> stakeholders.add(Map.of(
                "mark", s.isValidated() ? "[x]" : "[ ]",
                "name", s.getName(),
                "type", WireNames.of(s.getType()),
                "notes", orDefault(s.getNotes(), ""))));
        view.put("stakeholders", stakeholders);

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Assumption a : open) {
            rows.add(Map.of(
                    "id", a.getId(),
                    "claim", tableCell(a.getClaim()),
                    "impact", WireNames.of(a.getImpact()),
                    "confidence", WireNames.of(a.getConfidence()),
                    "status", WireNames.of(a.getStatus())));
        }
        view.put("assumptions", rows);

        SuccessMetrics metrics = skeleton.getSuccessMetrics();
        List<Map<String, Object>> metricLines = new ArrayList<>();
        addMetric(metricLines, "Leading", metrics.getLeading());
        addMetric(metricLines, "Lagging", metrics.getLagging());
        addMetric(metricLines, "Anti-metric", metrics.getAntiMetric());
        view.put("metrics", metricLines);

        DecisionCriteria criteria = skeleton.getDecisionCriteria();
        view.put("proceedIf", criteria.getProceedIf());
        view.put("doNotProceedIf", criteria.getDoNotProceedIf());
        return view;
    }

    private static Map<String, Object> solutionEvaluationView(FindingSkeleton skeleton, List<Assumption> open) {
        SolutionEvaluation evaluation = skeleton.getSolutionEvaluation();
        Map<String, Object> view = new HashMap<>();
        view.put("solutionName", orDefault(evaluation.getSolutionName(), "_Unnamed_"));
        view.put("solutionDescription", orDefault(evaluation.getSolutionDescription(), "_No description_"));
        view.put("problemStatement", orDefault(skeleton.getProblemStatement(), "_No problem statement from problem discovery_"));
        view.put("buildVsBuy", orDefault(evaluation.getBuildVsBuy(), "_Not applicable or not assessed_"));

        List<Map<String, Object>> risks = new ArrayList<>();
        for (RiskDimension dimension : RiskDimension.values()) {
            risks.add(riskView(dimension, evaluation.getRisk(dimension)));
        }
        view.put("risks", risks);

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Assumption a : open) {
            rows.add(Map.of(
                    "id", a.getId(),
                    "claim", tableCell(a.getClaim()),
                    "impact", WireNames.of(a.getImpact()),
                    "confidence", WireNames.of(a.getConfidence()),
                    "action", tableCell(orDefault(a.getRecommendedAction(), ""))));
        }
        view.put("assumptions", rows);

        ValidationPlan plan = evaluation.getValidationPlan();
        if (plan != null) {
            Map<String, Object> planView = new HashMap<>();
            planView.put("riskiestAssumption", plan.getRiskiestAssumption());
            planView.put("approach", WireNames.of(plan.getApproach()));
            planView.put("description", orDefault(plan.getDescription(), ""));
            planView.put("timeline", plan.getTimeline());
            planView.put("successCriteria", plan.getSuccessCriteria());
            view.put("validationPlan", planView);
        }

        GoNoGo goNoGo = evaluation.getGoNoGo();
        view.put("recommendation", goNoGo == null || goNoGo.getRecommendation() == null
                ? "NOT YET DETERMINED"
                : goNoGo.getRecommendation().name().replace('_', ' '));
        view.put("conditions", goNoGo == null ? List.of() : goNoGo.getConditions());
        view.put("dealbreakers", goNoGo == null ? List.of() : goNoGo.getDealbreakers());
        return view;
    }

    private static Map<String, Object> riskView(RiskDimension dimension, RiskAssessment risk) {
        Map<String, Object> view = new HashMap<>();
        view.put("name", dimension.getDisplayName());
        if (risk != null) {
            view.put("assessed", true);
            view.put("level", risk.getLevel() == null ? "UNRATED" : risk.getLevel().name().toUpperCase(Locale.ROOT));
            view.put("summary", orDefault(risk.getSummary(), "_No summary_"));
            List<String> evidenceFor = risk.getEvidenceFor() == null ? List.of() : risk.getEvidenceFor();
            List<String> evidenceAgainst = risk.getEvidenceAgainst() == null ? List.of() : risk.getEvidenceAgainst();
            view.put("evidenceFor", evidenceFor);
            view.put("evidenceAgainst", evidenceAgainst);
            view.put("hasEvidenceFor", !evidenceFor.isEmpty());
            view.put("hasEvidenceAgainst", !evidenceAgainst.isEmpty());
        }
        return view;
    }

    private static void addMetric(List<Map<String, Object>> lines, String label, String value) {
        if (!isBlank(value)) {
            lines.add(Map.of("label", label, "value", value));
        }
    }

    private static String tableCell(String text) {
        return text == null ? "" : text.replace("|", "\\|").replace('\n', ' ');
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
