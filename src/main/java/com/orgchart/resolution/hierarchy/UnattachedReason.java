package com.orgchart.resolution.hierarchy;

/**
 * Why a record was left out of the tree.
 */
public enum UnattachedReason {
    /** The parent reference matched no entity. */
    UNRESOLVED_PARENT,
    /** The record names itself as its parent. */
    SELF_REFERENCE,
    /** A record below level 1 has no parent reference. */
    MISSING_PARENT_REFERENCE,
    /** A second record at level 0. */
    DUPLICATE_ROOT,
    /** The resolved parent, or one of its ancestors, is itself unattached. */
    DETACHED_ANCESTOR
}
