package com.purchasingpower.forge.factstore;

import com.purchasingpower.forge.model.assumption.Assumption;

/**
 * @param created false when an existing assumption with the same claim was returned instead
 */
public record RegistrationResult(Assumption assumption, boolean created) {
}
