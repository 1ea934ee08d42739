package io.github.cyfko.fuzzycast.jpa;

import io.github.cyfko.fuzzycast.core.api.Condition;
import io.github.cyfko.fuzzycast.core.model.CompositeCondition;
import io.github.cyfko.fuzzycast.core.model.FieldCondition;
import io.github.cyfko.fuzzycast.core.model.NegatedCondition;
import io.github.cyfko.fuzzycast.core.model.SearchExpression;
import io.github.cyfko.fuzzycast.jpa.spi.PredicateResolver;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.Locale;
import java.util.Objects;

/**
 * Translates a {@link SearchExpression} into a JPA Criteria API {@link PredicateResolver}.
 *
 * <p><strong>Operator mapping:</strong></p>
 * <ul>
 *   <li>{@code EQ} becomes {@code cb.equal(path, value)}</li>
 *   <li>{@code NE} becomes {@code cb.notEqual(path, value)}</li>
 *   <li>{@code MATCHES} becomes {@code cb.like(path, pattern, '\')}</li>
 *   <li>{@code IMATCHES} becomes {@code cb.like(cb.lower(path), lower(pattern), '\')}</li>
 * </ul>
 * <p>
 * Composite conditions map to {@code cb.and}/{@code cb.or} and negations to {@code cb.not}.
 * The clauses of the expression are AND'ed; an expression without clauses resolves to
 * {@code cb.conjunction()}, i.e. every record of the entity.
 * </p>
 *
 * @since 1.0.0
 */
public final class JpaSearchExpressionResolver {

    private JpaSearchExpressionResolver() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Builds a resolver for the expression, typed after its source entity.
     *
     * @param expression the composed expression
     * @param <E> the source entity type
     * @return a resolver applicable to a root over the expression's entity type
     */
    public static <E> PredicateResolver<E> toResolver(SearchExpression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        return (root, query, cb) -> expression.toCondition()
                .map(condition -> toPredicate(condition, root, cb))
                .orElseGet(cb::conjunction);
    }

    /**
     * Builds a resolver for the expression after checking it targets {@code entityType}.
     *
     * @param expression the composed expression
     * @param entityType the expected source entity type
     * @param <E> the source entity type
     * @return a resolver applicable to a {@code Root<E>}
     * @throws IllegalArgumentException if the expression is over another entity type
     */
    public static <E> PredicateResolver<E> toResolver(SearchExpression expression, Class<E> entityType) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(entityType, "entityType cannot be null");
        if (!entityType.equals(expression.getEntityType())) {
            throw new IllegalArgumentException(String.format(
                    "Expression is over %s, not %s",
                    expression.getEntityType().getSimpleName(), entityType.getSimpleName()));
        }
        return toResolver(expression);
    }

    /**
     * Translates a single condition tree against the given root.
     *
     * @param condition the condition to translate
     * @param root the query root
     * @param cb the criteria builder
     * @return the equivalent predicate
     * @throws IllegalArgumentException if the condition type is not one of the model's conditions
     */
    public static Predicate toPredicate(Condition condition, Root<?> root, CriteriaBuilder cb) {
        if (condition instanceof FieldCondition field) {
            return toPredicate(field, root, cb);
        }
        if (condition instanceof CompositeCondition composite) {
            Predicate[] operands = composite.operands().stream()
                    .map(operand -> toPredicate(operand, root, cb))
                    .toArray(Predicate[]::new);
            return switch (composite.kind()) {
                case ALL -> cb.and(operands);
                case ANY -> cb.or(operands);
            };
        }
        if (condition instanceof NegatedCondition negated) {
            return cb.not(toPredicate(negated.operand(), root, cb));
        }
        throw new IllegalArgumentException("Unsupported condition type: " + condition.getClass().getName());
    }

    private static Predicate toPredicate(FieldCondition condition, Root<?> root, CriteriaBuilder cb) {
        Path<?> path = root.get(condition.field());
        Object value = condition.value();

        return switch (condition.op()) {
            case EQ -> cb.equal(path, value);
            case NE -> cb.notEqual(path, value);
            case MATCHES -> cb.like(castToStringPath(path), (String) value, FieldCondition.LIKE_ESCAPE);
            case IMATCHES -> cb.like(
                    cb.lower(castToStringPath(path)),
                    ((String) value).toLowerCase(Locale.ROOT),
                    FieldCondition.LIKE_ESCAPE);
        };
    }

    @SuppressWarnings("unchecked")
    private static Expression<String> castToStringPath(Path<?> path) {
        return (Expression<String>) path;
    }
}
