package com.purchasingpower.forge.model.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/**
 * Organisational context gathered during the conversation. Text is appended, never replaced.
 */
@Data
public class OrgContext {
    private String company;
    private String publicContext = "";
    private String internalContext = "";
    private String lastEnrichedDomain = "";
    private int enrichmentCount;

    @JsonIgnore
    public boolean isEmpty() {
        return (company == null || company.isBlank())
                && (publicContext == null || publicContext.isBlank())
                && (internalContext == null || internalContext.isBlank());
    }
}
