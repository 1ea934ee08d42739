package io.github.cyfko.fuzzycast.jpa.spi;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Deferred generator of JPA Criteria API predicates.
 * <p>
 * A {@code PredicateResolver} holds everything needed to build a {@link Predicate} but only
 * builds it once the query context (root, query, criteria builder) is known. The same instance
 * can therefore be applied to a select query and to a count query over the same entity.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * SearchExpression expression = fuzzyCast.compose(User.class, "gmail");
 * PredicateResolver<User> resolver = JpaSearchExpressionResolver.toResolver(expression, User.class);
 *
 * CriteriaBuilder cb = entityManager.getCriteriaBuilder();
 * CriteriaQuery<User> query = cb.createQuery(User.class);
 * Root<User> root = query.from(User.class);
 * query.where(resolver.resolve(root, query, cb));
 * }</pre>
 *
 * <p>Implementations are stateless and may be shared between threads.</p>
 *
 * @param <E> the entity type this resolver applies to
 * @since 1.0.0
 */
@FunctionalInterface
public interface PredicateResolver<E> {

    /**
     * Builds the predicate for the given query context.
     *
     * @param root the query root, giving access to entity attributes
     * @param query the criteria query being built
     * @param cb the criteria builder used to create the predicate
     * @return the predicate, never {@code null}
     * @throws IllegalArgumentException if a referenced attribute does not exist on the root entity
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb);
}
