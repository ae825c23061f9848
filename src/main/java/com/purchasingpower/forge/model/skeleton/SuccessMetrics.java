package com.purchasingpower.forge.model.skeleton;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

@Data
public class SuccessMetrics {
    private String leading;
    private String lagging;
    private String antiMetric;

    @JsonIgnore
    public boolean isEmpty() {
        return leading == null && lagging == null && antiMetric == null;
    }
}
