package com.orgchart.resolution.hierarchy;

import java.util.Locale;
import java.util.Objects;

/**
 * Options for hierarchy building.
 */
public class HierarchyOptions {

    private static final String DEFAULT_SYNTHETIC_ROOT_NAME = "State Government";

    private final String syntheticRootName;
    private final Locale locale;

    private HierarchyOptions(Builder builder) {
        this.syntheticRootName = builder.syntheticRootName;
        this.locale = builder.locale;
    }

    /**
     * Name of the root fabricated when the input has no level-0 record.
     */
    public String getSyntheticRootName() {
        return syntheticRootName;
    }

    /**
     * Locale used to order siblings.
     */
    public Locale getLocale() {
        return locale;
    }

    public static HierarchyOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String syntheticRootName = DEFAULT_SYNTHETIC_ROOT_NAME;
        private Locale locale = Locale.ENGLISH;

        public Builder syntheticRootName(String syntheticRootName) {
            if (syntheticRootName == null || syntheticRootName.isBlank()) {
                throw new IllegalArgumentException("syntheticRootName must not be blank");
            }
            this.syntheticRootName = syntheticRootName;
            return this;
        }

        public Builder locale(Locale locale) {
            this.locale = Objects.requireNonNull(locale, "locale");
            return this;
        }

        public HierarchyOptions build() {
            return new HierarchyOptions(this);
        }
    }

    @Override
    public String toString() {
        return "HierarchyOptions{" +
                "syntheticRootName='" + syntheticRootName + '\'' +
                ", locale=" + locale +
                '}';
    }
}
