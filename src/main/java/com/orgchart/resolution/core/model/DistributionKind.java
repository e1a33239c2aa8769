package com.orgchart.resolution.core.model;

/**
 * Workforce histograms carried by an entity record, one bucket list per year.
 */
public enum DistributionKind {
    TENURE,
    SALARY,
    AGE
}
