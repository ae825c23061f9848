package com.purchasingpower.forge.factstore;

import com.purchasingpower.forge.model.assumption.Assumption;
import com.purchasingpower.forge.model.skeleton.FindingSkeleton;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactStoreSnapshot {

    @Builder.Default
    private List<Assumption> assumptions = new ArrayList<>();

    private int assumptionCounter;

    private FindingSkeleton skeleton;
}
