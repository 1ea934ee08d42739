package io.github.cyfko.fuzzycast.jpa;

import io.github.cyfko.fuzzycast.core.model.SearchExpression;
import io.github.cyfko.fuzzycast.jpa.spi.PredicateResolver;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;

import java.util.Objects;

/**
 * Builds ready-to-run Criteria queries from a {@link SearchExpression}.
 * <p>
 * Nothing is executed here: hand the returned query to your own {@code EntityManager}.
 * </p>
 *
 * <pre>{@code
 * CriteriaBuilder cb = em.getCriteriaBuilder();
 * List<User> users = em.createQuery(JpaSearchQueries.select(cb, User.class, expression)).getResultList();
 * Long total = em.createQuery(JpaSearchQueries.count(cb, expression)).getSingleResult();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class JpaSearchQueries {

    private JpaSearchQueries() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Selects the entities matching the expression.
     *
     * @param cb the criteria builder
     * @param entityType the source entity type of the expression
     * @param expression the composed expression
     * @param <E> the entity type
     * @return a query selecting matching entities
     * @throws IllegalArgumentException if the expression is over another entity type
     */
    public static <E> CriteriaQuery<E> select(CriteriaBuilder cb, Class<E> entityType, SearchExpression expression) {
        PredicateResolver<E> resolver = JpaSearchExpressionResolver.toResolver(expression, entityType);

        CriteriaQuery<E> query = cb.createQuery(entityType);
        Root<E> root = query.from(entityType);
        query.select(root).where(resolver.resolve(root, query, cb));
        return query;
    }

    /**
     * Selects the entities matching the expression, typed after its source entity.
     *
     * @param cb the criteria builder
     * @param expression the composed expression
     * @param <E> the entity type
     * @return a query selecting matching entities
     */
    @SuppressWarnings("unchecked")
    public static <E> CriteriaQuery<E> select(CriteriaBuilder cb, SearchExpression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        return select(cb, (Class<E>) expression.getEntityType(), expression);
    }

    /**
     * Counts the entities matching the expression.
     *
     * @param cb the criteria builder
     * @param expression the composed expression
     * @return a query returning the number of matching entities
     */
    public static CriteriaQuery<Long> count(CriteriaBuilder cb, SearchExpression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");

        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<?> root = query.from(expression.getEntityType());
        PredicateResolver<Object> resolver = JpaSearchExpressionResolver.toResolver(expression);

        @SuppressWarnings({"rawtypes", "unchecked"})
        Root<Object> typedRoot = (Root) root;
        query.select(cb.count(root)).where(resolver.resolve(typedRoot, query, cb));
        return query;
    }
}
