package io.github.cyfko.fuzzycast.core.api;

import io.github.cyfko.fuzzycast.core.model.CompositeCondition;
import io.github.cyfko.fuzzycast.core.model.FieldCondition;
import io.github.cyfko.fuzzycast.core.model.NegatedCondition;

/**
 * Backend-agnostic, composable boolean filter condition.
 * <p>
 * A {@code Condition} is a node of the boolean expression tree carried by a
 * {@link io.github.cyfko.fuzzycast.core.model.SearchExpression}. Leaves are {@link FieldCondition}s
 * (a comparison on one entity field), inner nodes are {@link CompositeCondition}s (AND / OR over
 * two or more operands) and {@link NegatedCondition}s.
 * </p>
 *
 * <h2>Core Concepts</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> every operation returns a new {@code Condition}, the receiver
 *       is never modified. A condition handed to a caller stays valid for any later use.</li>
 *   <li><strong>Structural equality:</strong> two conditions built from the same fields, operators and
 *       values in the same order are {@code equals}. Reproducible composition relies on it.</li>
 *   <li><strong>Flattening:</strong> combining with the same operator extends the existing group instead
 *       of nesting it, so {@code a.or(b).or(c)} is the single group {@code (a OR b OR c)}.</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Condition gmail = FieldCondition.containsIgnoreCase("email", "gmail");
 * Condition yahoo = FieldCondition.containsIgnoreCase("email", "yahoo");
 * Condition active = FieldCondition.equal("active", true);
 *
 * // (email ILIKE '%gmail%' OR email ILIKE '%yahoo%') AND active = true
 * Condition combined = gmail.or(yahoo).and(active);
 * }</pre>
 *
 * <p>
 * Backend adapters (for instance the JPA adapter) translate the tree into their own predicate
 * representation; the core never executes anything.
 * </p>
 *
 * @see io.github.cyfko.fuzzycast.core.model.SearchExpression
 * @since 1.0.0
 */
public interface Condition {

    /**
     * Creates a new condition representing the logical AND of this condition and another.
     *
     * @param other the other condition, must not be {@code null}
     * @return a new condition representing (this AND other)
     * @throws NullPointerException if {@code other} is {@code null}
     */
    Condition and(Condition other);

    /**
     * Creates a new condition representing the logical OR of this condition and another.
     *
     * @param other the other condition, must not be {@code null}
     * @return a new condition representing (this OR other)
     * @throws NullPointerException if {@code other} is {@code null}
     */
    Condition or(Condition other);

    /**
     * Creates a new condition representing the logical negation of this condition.
     *
     * @return a new condition representing NOT(this)
     */
    Condition not();
}
