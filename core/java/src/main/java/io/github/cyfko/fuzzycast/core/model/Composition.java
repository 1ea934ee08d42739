package io.github.cyfko.fuzzycast.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of running a {@link CompositionRequest}: the request itself, the fields that were
 * eligible, the accepted casts and the resulting expression.
 *
 * @param request the request that was run
 * @param eligibleFields fields terms were matched against, after the allowlist and protection rule
 * @param fieldCasts accepted (term, field) casts, grouped by term in term order
 * @param expression the composed expression
 * @since 1.0.0
 */
public record Composition(CompositionRequest request,
                          List<String> eligibleFields,
                          List<FieldCast> fieldCasts,
                          SearchExpression expression) {

    public Composition {
        Objects.requireNonNull(request, "request cannot be null");
        Objects.requireNonNull(expression, "expression cannot be null");
        eligibleFields = List.copyOf(eligibleFields);
        fieldCasts = List.copyOf(fieldCasts);
    }
}
