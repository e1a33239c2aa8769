package com.orgchart.resolution.matching;

/**
 * How a free-text name was tied to an entity record.
 */
public enum EntityMatchType {
    ENTITY_CODE,
    EXACT_NAME,
    CANONICAL_NAME,
    ALIAS,
    PARTIAL
}
