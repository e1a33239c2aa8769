package com.orgchart.resolution.hierarchy;

/**
 * How a node's parent was found.
 */
public enum ParentResolution {
    /** The node is the root. */
    ROOT,
    EXACT_NAME,
    CANONICAL_NAME,
    ALIAS,
    /** Normalized name or alias of a candidate one level up contains, or is contained in, the reference. */
    CONTAINMENT,
    /** A level-1 record without a parent reference, placed under the root. */
    DEFAULT_ROOT;

    /**
     * True for resolutions that are always reported as fuzzy parent resolutions.
     */
    public boolean isApproximate() {
        return this == CONTAINMENT;
    }
}
