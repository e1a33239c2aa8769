package com.orgchart.resolution.diagnostics;

/**
 * Kinds of data-quality events reported while indexing, building and aggregating.
 */
public enum DiagnosticType {
    /**
     * A record could not be attached to the tree.
     */
    UNATTACHED(Severity.WARN),

    /**
     * A record names itself as its parent.
     */
    SELF_REFERENCE(Severity.ERROR),

    /**
     * An alias is claimed by more than one entity; the first registration wins.
     */
    DUPLICATE_ALIAS(Severity.WARN),

    /**
     * Two records share the same exact name; the first registration wins.
     */
    DUPLICATE_NAME(Severity.WARN),

    /**
     * More than one record declares org level 0.
     */
    DUPLICATE_ROOT(Severity.WARN),

    /**
     * A parent lookup returned an entity at the same or a deeper level.
     */
    LEVEL_INVERSION(Severity.WARN),

    /**
     * A parent was found only through containment or fuzzy scoring.
     */
    FUZZY_PARENT_RESOLUTION(Severity.INFO),

    /**
     * A histogram bucket was missing its range or carried an invalid count.
     */
    MALFORMED_DISTRIBUTION(Severity.WARN),

    /**
     * An input record failed boundary validation and was skipped.
     */
    INVALID_RECORD(Severity.WARN);

    private final Severity defaultSeverity;

    DiagnosticType(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }
}
