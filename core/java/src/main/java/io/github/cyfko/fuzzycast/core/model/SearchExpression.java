package io.github.cyfko.fuzzycast.core.model;

import io.github.cyfko.fuzzycast.core.api.Condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable filter expression over the records of one entity type.
 * <p>
 * A {@code SearchExpression} is the value handed between composition calls and, eventually, to the
 * query layer that executes it. It consists of a <em>source</em> (the entity type whose records are
 * filtered) and an ordered list of <em>clauses</em> that are AND'ed together. An expression without
 * clauses selects every record of the source.
 * </p>
 *
 * <h2>Composition Primitives</h2>
 * <ul>
 *   <li>{@link #from(Class)}: all records of an entity type</li>
 *   <li>{@link #hasConditions()}: whether at least one clause filters the source</li>
 *   <li>{@link #where(Condition)}: AND a new clause</li>
 *   <li>{@link #orWhere(Condition)}: OR a condition into the most recent clause</li>
 * </ul>
 * <p>
 * Every primitive returns a new instance; the receiver is never modified, so a caller may keep
 * reusing an expression after composing on top of it.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * SearchExpression expression = SearchExpression.from(User.class)
 *     .where(FieldCondition.containsIgnoreCase("email", "bob"))
 *     .where(FieldCondition.containsIgnoreCase("email", "m"))
 *     .orWhere(FieldCondition.containsIgnoreCase("name", "m"));
 *
 * // User WHERE email ILIKE '%bob%' AND (email ILIKE '%m%' OR name ILIKE '%m%')
 * }</pre>
 *
 * @since 1.0.0
 */
public final class SearchExpression {

    private final Class<?> entityType;
    private final List<Condition> clauses;

    private SearchExpression(Class<?> entityType, List<Condition> clauses) {
        this.entityType = entityType;
        this.clauses = clauses;
    }

    /**
     * Creates an expression selecting all records of the given entity type.
     *
     * @param entityType the source entity type
     * @return an unfiltered expression
     * @throws NullPointerException if {@code entityType} is {@code null}
     */
    public static SearchExpression from(Class<?> entityType) {
        return new SearchExpression(Objects.requireNonNull(entityType, "entityType cannot be null"), List.of());
    }

    /**
     * Returns the source entity type of this expression.
     */
    public Class<?> getEntityType() {
        return entityType;
    }

    /**
     * Returns the AND'ed clauses of this expression, in the order they were added.
     *
     * @return an immutable list, empty when nothing filters the source
     */
    public List<Condition> getClauses() {
        return clauses;
    }

    /**
     * Indicates whether this expression filters its source with at least one condition.
     */
    public boolean hasConditions() {
        return !clauses.isEmpty();
    }

    /**
     * Returns a new expression with {@code condition} AND'ed as an additional clause.
     *
     * @param condition the clause to add
     * @return a new expression
     */
    public SearchExpression where(Condition condition) {
        Objects.requireNonNull(condition, "condition cannot be null");
        List<Condition> extended = new ArrayList<>(clauses);
        extended.add(condition);
        return new SearchExpression(entityType, Collections.unmodifiableList(extended));
    }

    /**
     * Returns a new expression with {@code condition} OR'ed into the most recent clause.
     * When there is no clause yet, {@code condition} becomes the first one.
     *
     * @param condition the condition to OR in
     * @return a new expression
     */
    public SearchExpression orWhere(Condition condition) {
        Objects.requireNonNull(condition, "condition cannot be null");
        if (clauses.isEmpty()) {
            return where(condition);
        }
        List<Condition> replaced = new ArrayList<>(clauses);
        int last = replaced.size() - 1;
        replaced.set(last, replaced.get(last).or(condition));
        return new SearchExpression(entityType, Collections.unmodifiableList(replaced));
    }

    /**
     * Folds the clauses into a single condition.
     *
     * @return the conjunction of all clauses, or empty when the expression has no clause
     */
    public Optional<Condition> toCondition() {
        return clauses.stream().reduce(Condition::and);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchExpression that)) return false;
        return entityType.equals(that.entityType) && clauses.equals(that.clauses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityType, clauses);
    }

    @Override
    public String toString() {
        if (clauses.isEmpty()) {
            return entityType.getSimpleName();
        }
        return entityType.getSimpleName() + " WHERE " + clauses.stream()
                .map(Object::toString)
                .collect(Collectors.joining(" AND "));
    }
}
