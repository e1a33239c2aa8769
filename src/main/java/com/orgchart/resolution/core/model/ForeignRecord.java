package com.orgchart.resolution.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A record taken from another dataset (spending, workforce, budget, content) that
 * refers to an entity through a structured code and/or free-text fields.
 */
public final class ForeignRecord {
    private final DatasetSource source;
    private final String organizationCode;
    private final Map<CandidateField, String> fields;

    private ForeignRecord(Builder builder) {
        this.source = builder.source;
        this.organizationCode = blankToNull(builder.organizationCode);
        EnumMap<CandidateField, String> copy = new EnumMap<>(CandidateField.class);
        builder.fields.forEach((field, value) -> {
            if (value != null && !value.isBlank()) {
                copy.put(field, value);
            }
        });
        this.fields = Collections.unmodifiableMap(copy);
    }

    public DatasetSource getSource() {
        return source;
    }

    public Optional<String> getOrganizationCode() {
        return Optional.ofNullable(organizationCode);
    }

    /**
     * Returns the non-blank value of a field, if present.
     */
    public Optional<String> get(CandidateField field) {
        return Optional.ofNullable(fields.get(field));
    }

    /**
     * Non-blank fields in priority order.
     */
    public Map<CandidateField, String> getFields() {
        return fields;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ForeignRecord that = (ForeignRecord) o;
        return source == that.source
                && Objects.equals(organizationCode, that.organizationCode)
                && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, organizationCode, fields);
    }

    @Override
    public String toString() {
        return "ForeignRecord{" +
                "source=" + source +
                ", organizationCode='" + organizationCode + '\'' +
                ", fields=" + fields +
                '}';
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static class Builder {
        private DatasetSource source = DatasetSource.OTHER;
        private String organizationCode;
        private final Map<CandidateField, String> fields = new EnumMap<>(CandidateField.class);

        public Builder source(DatasetSource source) {
            this.source = Objects.requireNonNull(source, "source");
            return this;
        }

        public Builder organizationCode(String organizationCode) {
            this.organizationCode = organizationCode;
            return this;
        }

        public Builder field(CandidateField field, String value) {
            Objects.requireNonNull(field, "field");
            fields.put(field, value);
            return this;
        }

        public Builder department(String value) {
            return field(CandidateField.DEPARTMENT, value);
        }

        public Builder departmentName(String value) {
            return field(CandidateField.DEPARTMENT_NAME, value);
        }

        public Builder vendor(String value) {
            return field(CandidateField.VENDOR, value);
        }

        public Builder program(String value) {
            return field(CandidateField.PROGRAM, value);
        }

        public Builder programName(String value) {
            return field(CandidateField.PROGRAM_NAME, value);
        }

        public Builder description(String value) {
            return field(CandidateField.DESCRIPTION, value);
        }

        public Builder programDescription(String value) {
            return field(CandidateField.PROGRAM_DESCRIPTION, value);
        }

        public ForeignRecord build() {
            return new ForeignRecord(this);
        }
    }
}
