package com.purchasingpower.forge.exception;

import lombok.Getter;

@Getter
public class AssumptionNotFoundException extends RuntimeException {

    private final String assumptionId;

    public AssumptionNotFoundException(String assumptionId) {
        super("Assumption " + assumptionId + " not found");
        this.assumptionId = assumptionId;
    }
}
