package io.github.cyfko.fuzzycast.core.model;

import io.github.cyfko.fuzzycast.core.config.GroupingMode;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Optional settings of a composition call.
 * <ul>
 *   <li>{@code fields}: restricts the fields terms are matched against (caller's order is kept)</li>
 *   <li>{@code baseExpression}: an existing expression to merge into instead of "all records"</li>
 *   <li>{@code groupingMode}: overrides the configured {@link GroupingMode}</li>
 * </ul>
 *
 * <pre>{@code
 * CompositionOptions options = CompositionOptions.builder()
 *     .fields("email", "name")
 *     .baseExpression(activeUsers)
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class CompositionOptions {

    private static final CompositionOptions NONE = builder().build();

    private final List<String> fields;
    private final SearchExpression baseExpression;
    private final GroupingMode groupingMode;

    private CompositionOptions(Builder builder) {
        this.fields = builder.fields;
        this.baseExpression = builder.baseExpression;
        this.groupingMode = builder.groupingMode;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CompositionOptions none() {
        return NONE;
    }

    public static CompositionOptions fields(String... fields) {
        return builder().fields(fields).build();
    }

    public Optional<List<String>> getFields() {
        return Optional.ofNullable(fields);
    }

    public Optional<SearchExpression> getBaseExpression() {
        return Optional.ofNullable(baseExpression);
    }

    public Optional<GroupingMode> getGroupingMode() {
        return Optional.ofNullable(groupingMode);
    }

    /**
     * Returns a copy of these options using {@code expression} as base expression.
     */
    public CompositionOptions withBaseExpression(SearchExpression expression) {
        return toBuilder().baseExpression(expression).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.fields = fields;
        builder.baseExpression = baseExpression;
        builder.groupingMode = groupingMode;
        return builder;
    }

    @Override
    public String toString() {
        return "CompositionOptions[fields=" + fields + ", baseExpression=" + baseExpression
                + ", groupingMode=" + groupingMode + "]";
    }

    public static final class Builder {
        private List<String> fields;
        private SearchExpression baseExpression;
        private GroupingMode groupingMode;

        /**
         * Restricts the eligible fields. {@code null} means every schema field.
         */
        /**
         * Restricts the search to the given fields; {@code null} means every schema field.
         *
         * @throws NullPointerException if one of the names is {@code null}
         */
        public Builder fields(Collection<String> fields) {
            if (fields == null) {
                this.fields = null;
                return this;
            }
            for (String field : fields) {
                Objects.requireNonNull(field, "field name cannot be null");
            }
            this.fields = List.copyOf(fields);
            return this;
        }

        public Builder fields(String... fields) {
            return fields(fields == null ? null : Arrays.asList(fields));
        }

        public Builder baseExpression(SearchExpression baseExpression) {
            this.baseExpression = baseExpression;
            return this;
        }

        public Builder groupingMode(GroupingMode groupingMode) {
            this.groupingMode = groupingMode;
            return this;
        }

        public CompositionOptions build() {
            return new CompositionOptions(this);
        }
    }
}
