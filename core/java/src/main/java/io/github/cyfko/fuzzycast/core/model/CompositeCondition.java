package io.github.cyfko.fuzzycast.core.model;

import io.github.cyfko.fuzzycast.core.api.Condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Conjunction ({@link Kind#ALL}) or disjunction ({@link Kind#ANY}) of two or more conditions.
 * <p>
 * Combining a composite with a condition of the same kind appends to its operand list, so groups
 * stay flat and their order mirrors the order in which operands were added.
 * </p>
 *
 * @param kind whether all or any of the operands must hold
 * @param operands the operands, at least two
 * @since 1.0.0
 */
public record CompositeCondition(Kind kind, List<Condition> operands) implements Condition {

    public enum Kind {
        ALL("AND"),
        ANY("OR");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    public CompositeCondition {
        Objects.requireNonNull(kind, "kind cannot be null");
        operands = List.copyOf(Objects.requireNonNull(operands, "operands cannot be null"));
        if (operands.size() < 2) {
            throw new IllegalArgumentException(kind + " requires at least two operands, got " + operands.size());
        }
    }

    static Condition combine(Kind kind, Condition left, Condition right) {
        Objects.requireNonNull(left, "Left condition cannot be null");
        Objects.requireNonNull(right, "Other condition cannot be null");

        List<Condition> flattened = new ArrayList<>();
        appendFlattened(kind, left, flattened);
        appendFlattened(kind, right, flattened);
        return new CompositeCondition(kind, flattened);
    }

    private static void appendFlattened(Kind kind, Condition condition, List<Condition> target) {
        if (condition instanceof CompositeCondition composite && composite.kind == kind) {
            target.addAll(composite.operands);
        } else {
            target.add(condition);
        }
    }

    @Override
    public Condition and(Condition other) {
        return combine(Kind.ALL, this, other);
    }

    @Override
    public Condition or(Condition other) {
        return combine(Kind.ANY, this, other);
    }

    @Override
    public Condition not() {
        return new NegatedCondition(this);
    }

    @Override
    public String toString() {
        return operands.stream()
                .map(Object::toString)
                .collect(Collectors.joining(" " + kind.getKeyword() + " ", "(", ")"));
    }
}
