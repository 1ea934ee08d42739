package io.github.cyfko.fuzzycast.core;

import io.github.cyfko.fuzzycast.core.api.SchemaMetadata;
import io.github.cyfko.fuzzycast.core.config.FuzzyCastConfig;
import io.github.cyfko.fuzzycast.core.config.GroupingMode;
import io.github.cyfko.fuzzycast.core.exception.SchemaResolutionException;
import io.github.cyfko.fuzzycast.core.impl.ExpressionBuilder;
import io.github.cyfko.fuzzycast.core.impl.FieldEligibilityResolver;
import io.github.cyfko.fuzzycast.core.impl.TermCaster;
import io.github.cyfko.fuzzycast.core.model.Composition;
import io.github.cyfko.fuzzycast.core.model.CompositionOptions;
import io.github.cyfko.fuzzycast.core.model.CompositionRequest;
import io.github.cyfko.fuzzycast.core.model.FieldCast;
import io.github.cyfko.fuzzycast.core.model.SearchExpression;
import io.github.cyfko.fuzzycast.core.spi.SchemaRegistry;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point composing fuzzy search expressions across the fields of an entity.
 * <p>
 * Given one or more search terms, {@code FuzzyCast} finds every field each term is a plausible
 * value for, and builds a filter matching records where any of those fields matches any of the
 * terms. Text fields match by case-insensitive substring, other fields by equality with the term
 * converted to the field's type. The result is a {@link SearchExpression}; executing it is the job
 * of a backend adapter.
 * </p>
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li><strong>Field eligibility:</strong> the caller's field allowlist or every schema field, minus
 *       any field whose name contains {@code "password"}</li>
 *   <li><strong>Casting:</strong> each term is coerced into each eligible field's type; unknown fields
 *       and rejected terms are dropped silently</li>
 *   <li><strong>Building:</strong> the accepted casts are OR'ed into one group merged with the base
 *       expression (see {@link GroupingMode})</li>
 * </ol>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * FuzzyCast fuzzyCast = new FuzzyCast(SchemaRegistry.of(userSchema));
 *
 * // email ILIKE '%gmail%' OR email ILIKE '%yahoo%'
 * SearchExpression byProvider = fuzzyCast.compose(userSchema, List.of("gmail", "yahoo"));
 *
 * // Chaining narrows: (email ILIKE '%bob%') AND (email ILIKE '%m%' OR name ILIKE '%m%')
 * SearchExpression bob = fuzzyCast.compose(userSchema, "bob", CompositionOptions.fields("email"));
 * SearchExpression narrowed = fuzzyCast.compose(bob, "m");
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are immutable and hold no per-call state; a single instance can serve concurrent
 * callers. Expressions passed in are never modified.
 * </p>
 *
 * @since 1.0.0
 */
public final class FuzzyCast {

    private static final Logger logger = Logger.getLogger(FuzzyCast.class.getName());

    private final SchemaRegistry schemaRegistry;
    private final FuzzyCastConfig config;
    private final TermCaster termCaster;

    /**
     * Creates a composer without registered schemas and with the default configuration.
     * Only calls that receive a {@link SchemaMetadata} explicitly can succeed.
     */
    public FuzzyCast() {
        this(SchemaRegistry.empty());
    }

    public FuzzyCast(SchemaRegistry schemaRegistry) {
        this(schemaRegistry, FuzzyCastConfig.defaults());
    }

    public FuzzyCast(SchemaRegistry schemaRegistry, FuzzyCastConfig config) {
        this.schemaRegistry = Objects.requireNonNull(schemaRegistry, "schemaRegistry cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.termCaster = new TermCaster(config.getEnumMatchMode());
    }

    public SchemaRegistry getSchemaRegistry() {
        return schemaRegistry;
    }

    public FuzzyCastConfig getConfig() {
        return config;
    }

    // ========================================
    // Composition from scratch
    // ========================================

    public SearchExpression compose(SchemaMetadata schema, Object terms) {
        return compose(schema, terms, CompositionOptions.none());
    }

    /**
     * Composes a search over {@code schema}.
     *
     * @param schema the searched schema
     * @param terms a term, a collection or an array of terms; {@code null} means no term
     * @param options field allowlist, base expression and grouping mode, all optional
     * @return the composed expression, or the base expression unchanged when no term matched any field
     * @throws IllegalArgumentException if the base expression is over another entity type
     */
    public SearchExpression compose(SchemaMetadata schema, Object terms, CompositionOptions options) {
        return build(schema, terms, options).expression();
    }

    public SearchExpression compose(Class<?> entityType, Object terms) {
        return compose(entityType, terms, CompositionOptions.none());
    }

    /**
     * Composes a search over the registered schema of {@code entityType}.
     *
     * @throws SchemaResolutionException if no schema is registered for {@code entityType}
     */
    public SearchExpression compose(Class<?> entityType, Object terms, CompositionOptions options) {
        return compose(schemaRegistry.require(entityType), terms, options);
    }

    // ========================================
    // Composition onto an existing expression
    // ========================================

    public SearchExpression compose(SearchExpression existing, Object terms) {
        return compose(existing, terms, CompositionOptions.none());
    }

    /**
     * Composes a search on top of {@code existing}. The schema is the registered schema of the
     * expression's source entity type; {@code existing} takes precedence over any base expression
     * present in {@code options}.
     *
     * @throws SchemaResolutionException if the source schema of {@code existing} is not registered
     */
    public SearchExpression compose(SearchExpression existing, Object terms, CompositionOptions options) {
        Objects.requireNonNull(existing, "existing expression cannot be null");
        SchemaMetadata schema = schemaRegistry.require(existing.getEntityType());
        CompositionOptions opts = options == null ? CompositionOptions.none() : options;
        return compose(schema, terms, opts.withBaseExpression(existing));
    }

    // ========================================
    // Re-entrant composition
    // ========================================

    /**
     * Runs an already built request again. With unchanged inputs the result is structurally
     * identical to the previous run.
     */
    public SearchExpression compose(CompositionRequest request) {
        return run(request).expression();
    }

    /**
     * Builds and runs a request, exposing intermediate results.
     */
    public Composition build(SchemaMetadata schema, Object terms, CompositionOptions options) {
        return run(CompositionRequest.of(schema, terms, options));
    }

    public Composition run(CompositionRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        SchemaMetadata schema = request.getSchema();

        SearchExpression base = request.resolveBaseExpression();
        List<String> fields = FieldEligibilityResolver.resolve(schema, request.getFields().orElse(null));
        List<FieldCast> casts = termCaster.castAll(schema, request.getTerms(), fields);
        GroupingMode mode = request.getGroupingMode().orElse(config.getGroupingMode());
        SearchExpression expression = ExpressionBuilder.build(base, casts, mode);

        logger.fine(() -> String.format(
                "Composed fuzzy search on %s: terms=%s, eligibleFields=%s, casts=%d, mode=%s",
                schema.getEntityType().getSimpleName(), request.getTerms(), fields, casts.size(), mode
        ));

        return new Composition(request, fields, casts, expression);
    }
}
