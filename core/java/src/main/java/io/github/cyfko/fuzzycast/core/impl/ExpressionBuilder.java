package io.github.cyfko.fuzzycast.core.impl;

import io.github.cyfko.fuzzycast.core.api.Condition;
import io.github.cyfko.fuzzycast.core.config.GroupingMode;
import io.github.cyfko.fuzzycast.core.model.FieldCast;
import io.github.cyfko.fuzzycast.core.model.FieldCondition;
import io.github.cyfko.fuzzycast.core.model.SearchExpression;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Folds accepted casts into a base expression.
 * <p>
 * Text fields produce a case-insensitive substring match, every other type an equality. All
 * predicates of one call are OR'ed into a single group. With {@link GroupingMode#AND_NEW_GROUP}
 * that group is AND'ed with the base expression's existing clauses; with
 * {@link GroupingMode#OR_INTO_LAST_GROUP} it widens the most recent clause. Without any cast the
 * base expression is returned as is.
 * </p>
 */
public final class ExpressionBuilder {

    private ExpressionBuilder() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    public static SearchExpression build(SearchExpression base, List<FieldCast> casts, GroupingMode mode) {
        Objects.requireNonNull(base, "base expression cannot be null");
        Objects.requireNonNull(mode, "grouping mode cannot be null");
        if (casts.isEmpty()) {
            return base;
        }

        Iterator<FieldCast> iterator = casts.iterator();
        Condition first = toCondition(iterator.next());
        SearchExpression expression = mode == GroupingMode.OR_INTO_LAST_GROUP
                ? base.orWhere(first)
                : base.where(first);

        while (iterator.hasNext()) {
            expression = expression.orWhere(toCondition(iterator.next()));
        }
        return expression;
    }

    /**
     * Elementary predicate of one cast.
     */
    public static Condition toCondition(FieldCast cast) {
        if (cast.isText()) {
            return FieldCondition.containsIgnoreCase(cast.field(), cast.value().toString());
        }
        return FieldCondition.equal(cast.field(), cast.value());
    }
}
