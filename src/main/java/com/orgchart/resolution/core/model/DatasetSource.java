package com.orgchart.resolution.core.model;

/**
 * Dataset a foreign record was taken from.
 */
public enum DatasetSource {
    SPENDING,
    WORKFORCE,
    BUDGET,
    CONTENT,
    OTHER
}
