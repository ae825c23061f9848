package com.purchasingpower.forge.model.skeleton;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Stakeholder {
    private String id;
    private String name;
    private StakeholderType type;
    private boolean validated;
    private String notes;
}
