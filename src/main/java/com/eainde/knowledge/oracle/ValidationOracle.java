package com.eainde.knowledge.oracle;

/**
 * Supplies corroborating concepts per category.
 *
 * <p>Implementations must be pure within one run: the same category id always
 * yields the same record, and a lookup has no side effect visible to the
 * pipeline. Unknown categories return {@link ValidationRecord#empty(String)}.</p>
 */
@FunctionalInterface
public interface ValidationOracle {

    ValidationRecord lookup(String categoryId);

    /** An oracle that corroborates nothing. */
    static ValidationOracle none() {
        return ValidationRecord::empty;
    }
}
