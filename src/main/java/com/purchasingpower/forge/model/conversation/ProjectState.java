package com.purchasingpower.forge.model.conversation;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ProjectState {
    private List<FileSummary> fileSummaries = new ArrayList<>();

    public void putFileSummary(FileSummary summary) {
        fileSummaries.removeIf(existing -> existing.getSourceId().equals(summary.getSourceId()));
        fileSummaries.add(summary);
    }

    public boolean removeFileSummary(String sourceId) {
        return fileSummaries.removeIf(existing -> existing.getSourceId().equals(sourceId));
    }
}
