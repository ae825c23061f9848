package com.purchasingpower.forge.model.skeleton;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DecisionCriteria {
    private List<String> proceedIf = new ArrayList<>();
    private List<String> doNotProceedIf = new ArrayList<>();

    @JsonIgnore
    public List<String> listFor(CriterionType type) {
        return type == CriterionType.PROCEED_IF ? proceedIf : doNotProceedIf;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return proceedIf.isEmpty() && doNotProceedIf.isEmpty();
    }
}
