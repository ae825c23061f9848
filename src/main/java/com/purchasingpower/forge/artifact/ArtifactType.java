package com.purchasingpower.forge.artifact;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ArtifactType {
    @JsonProperty("problem_brief") PROBLEM_BRIEF("problem-brief.mustache", "problem_brief.md"),
    @JsonProperty("solution_evaluation_brief") SOLUTION_EVALUATION_BRIEF("solution-evaluation-brief.mustache", "solution_evaluation.md");

    private final String template;
    private final String fileName;

    ArtifactType(String template, String fileName) {
        this.template = template;
        this.fileName = fileName;
    }

    public String getTemplate() {
        return template;
    }

    public String getFileName() {
        return fileName;
    }
}
