package io.github.cyfko.fuzzycast.core.model;

import io.github.cyfko.fuzzycast.core.api.Condition;

import java.util.Objects;

/**
 * Logical negation of a condition. Negating again yields the original operand.
 *
 * @param operand the negated condition
 * @since 1.0.0
 */
public record NegatedCondition(Condition operand) implements Condition {

    public NegatedCondition {
        Objects.requireNonNull(operand, "operand cannot be null");
    }

    @Override
    public Condition and(Condition other) {
        return CompositeCondition.combine(CompositeCondition.Kind.ALL, this, other);
    }

    @Override
    public Condition or(Condition other) {
        return CompositeCondition.combine(CompositeCondition.Kind.ANY, this, other);
    }

    @Override
    public Condition not() {
        return operand;
    }

    @Override
    public String toString() {
        return "NOT (" + operand + ")";
    }
}
