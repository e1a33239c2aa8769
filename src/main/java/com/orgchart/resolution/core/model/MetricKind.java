package com.orgchart.resolution.core.model;

/**
 * Yearly scalar metrics carried by an entity record.
 * Scalars roll up from children to parents by summation.
 */
public enum MetricKind {
    /**
     * Number of employees.
     */
    HEADCOUNT,

    /**
     * Total wages paid.
     */
    WAGES
}
