package com.eainde.knowledge.catalog;

import com.eainde.knowledge.exception.InvariantViolationException;

import java.util.List;

/**
 * The category catalog failed load-time validation. Raised before any document
 * is scanned; the pipeline does not start.
 */
public class CatalogValidationException extends InvariantViolationException {

    private final List<String> violations;

    public CatalogValidationException(List<String> violations) {
        super("Category catalog is invalid: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
