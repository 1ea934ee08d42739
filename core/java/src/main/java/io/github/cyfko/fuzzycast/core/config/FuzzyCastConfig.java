package io.github.cyfko.fuzzycast.core.config;

import java.util.Objects;

/**
 * Central configuration object aggregating the behavioural strategies of fuzzy composition.
 * <p>
 * Defaults are {@link EnumMatchMode#CASE_INSENSITIVE} and {@link GroupingMode#AND_NEW_GROUP}.
 * The exclusion of fields whose name contains {@code "password"} is not a setting and cannot be
 * turned off here.
 * </p>
 */
public final class FuzzyCastConfig {

    private final EnumMatchMode enumMatchMode;
    private final GroupingMode groupingMode;

    private FuzzyCastConfig(Builder builder) {
        this.enumMatchMode = builder.enumMatchMode;
        this.groupingMode = builder.groupingMode;
    }

    public static Builder builder() { return new Builder(); }

    public static FuzzyCastConfig defaults() { return builder().build(); }

    public EnumMatchMode getEnumMatchMode() { return enumMatchMode; }
    public GroupingMode getGroupingMode() { return groupingMode; }

    @Override
    public String toString() {
        return "FuzzyCastConfig[enumMatchMode=" + enumMatchMode + ", groupingMode=" + groupingMode + "]";
    }

    /**
     * Builder for {@link FuzzyCastConfig}.
     */
    public static final class Builder {
        private EnumMatchMode enumMatchMode = EnumMatchMode.CASE_INSENSITIVE;
        private GroupingMode groupingMode = GroupingMode.AND_NEW_GROUP;

        public Builder enumMatchMode(EnumMatchMode mode) {
            this.enumMatchMode = Objects.requireNonNull(mode, "enumMatchMode");
            return this;
        }

        public Builder groupingMode(GroupingMode mode) {
            this.groupingMode = Objects.requireNonNull(mode, "groupingMode");
            return this;
        }

        public FuzzyCastConfig build() { return new FuzzyCastConfig(this); }
    }
}
