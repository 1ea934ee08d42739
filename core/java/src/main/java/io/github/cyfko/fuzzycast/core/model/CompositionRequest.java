package io.github.cyfko.fuzzycast.core.model;

import io.github.cyfko.fuzzycast.core.api.SchemaMetadata;
import io.github.cyfko.fuzzycast.core.config.GroupingMode;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one composition run needs: the schema, the normalized terms and the options.
 * <p>
 * Requests are immutable and can be run any number of times; running the same request twice
 * produces structurally identical expressions.
 * </p>
 *
 * <h2>Term Normalization</h2>
 * <ul>
 *   <li>{@code null} becomes no term at all</li>
 *   <li>a {@link Collection} or an array contributes its elements in order, {@code null} elements skipped</li>
 *   <li>any other object is a single term</li>
 * </ul>
 * Each term is converted to text with {@link String#valueOf(Object)}.
 *
 * @since 1.0.0
 */
public final class CompositionRequest {

    private final SchemaMetadata schema;
    private final List<String> terms;
    private final List<String> fields;
    private final SearchExpression baseExpression;
    private final GroupingMode groupingMode;

    private CompositionRequest(SchemaMetadata schema, List<String> terms, List<String> fields,
                               SearchExpression baseExpression, GroupingMode groupingMode) {
        this.schema = schema;
        this.terms = terms;
        this.fields = fields;
        this.baseExpression = baseExpression;
        this.groupingMode = groupingMode;
    }

    /**
     * Builds a request.
     *
     * @param schema the schema of the searched entity
     * @param terms a single term, a collection or an array of terms, or {@code null}
     * @param options composition options, {@code null} meaning none
     * @return the request
     * @throws IllegalArgumentException if the base expression is over another entity type than the schema
     */
    public static CompositionRequest of(SchemaMetadata schema, Object terms, CompositionOptions options) {
        Objects.requireNonNull(schema, "schema cannot be null");
        CompositionOptions opts = options == null ? CompositionOptions.none() : options;

        SearchExpression base = opts.getBaseExpression().orElse(null);
        if (base != null && !base.getEntityType().equals(schema.getEntityType())) {
            throw new IllegalArgumentException(String.format(
                    "Base expression is over %s but the schema describes %s",
                    base.getEntityType().getName(), schema.getEntityType().getName()));
        }

        List<String> fields = opts.getFields()
                .map(f -> List.copyOf(new LinkedHashSet<>(f)))
                .orElse(null);

        return new CompositionRequest(schema, normalizeTerms(terms), fields, base,
                opts.getGroupingMode().orElse(null));
    }

    /**
     * Normalizes caller input into an ordered list of textual terms.
     *
     * @param terms a single term, a collection or array of terms, or {@code null}
     * @return the terms as text
     */
    public static List<String> normalizeTerms(Object terms) {
        if (terms == null) {
            return List.of();
        }

        List<String> normalized = new ArrayList<>();
        if (terms instanceof Collection<?> collection) {
            for (Object term : collection) {
                if (term != null) normalized.add(String.valueOf(term));
            }
        } else if (terms.getClass().isArray()) {
            int length = Array.getLength(terms);
            for (int i = 0; i < length; i++) {
                Object term = Array.get(terms, i);
                if (term != null) normalized.add(String.valueOf(term));
            }
        } else {
            normalized.add(String.valueOf(terms));
        }
        return Collections.unmodifiableList(normalized);
    }

    public SchemaMetadata getSchema() {
        return schema;
    }

    public List<String> getTerms() {
        return terms;
    }

    /**
     * Returns the field allowlist, empty when every schema field is eligible.
     */
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
     * Returns the expression composition starts from: the base expression when one was given,
     * otherwise all records of the schema's entity type.
     */
    public SearchExpression resolveBaseExpression() {
        return baseExpression != null ? baseExpression : SearchExpression.from(schema.getEntityType());
    }

    @Override
    public String toString() {
        return "CompositionRequest[entity=" + schema.getEntityType().getSimpleName()
                + ", terms=" + terms + ", fields=" + fields + ", baseExpression=" + baseExpression
                + ", groupingMode=" + groupingMode + "]";
    }
}
