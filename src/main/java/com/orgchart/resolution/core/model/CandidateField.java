package com.orgchart.resolution.core.model;

/**
 * Text fields of a foreign record that may identify an entity, in priority order.
 * Structured name fields carry the highest weight, free-text descriptions the lowest.
 */
public enum CandidateField {
    DEPARTMENT("department", 1.2, true),
    DEPARTMENT_NAME("department name", 1.2, true),
    VENDOR("vendor", 1.0, false),
    PROGRAM("program", 0.8, false),
    PROGRAM_NAME("program name", 0.8, false),
    DESCRIPTION("description", 0.6, false),
    PROGRAM_DESCRIPTION("program desc", 0.6, false);

    private final String label;
    private final double weight;
    private final boolean nameField;

    CandidateField(String label, double weight, boolean nameField) {
        this.label = label;
        this.weight = weight;
        this.nameField = nameField;
    }

    public String label() {
        return label;
    }

    public double weight() {
        return weight;
    }

    /**
     * True for fields that carry the entity's name rather than related free text.
     */
    public boolean isNameField() {
        return nameField;
    }
}
