package io.github.cyfko.fuzzycast.core.config;

/**
 * How the predicates produced by one composition call are merged into the base expression.
 * <p>
 * Inside one call, every (term, field) predicate is always OR'ed with the others. The mode only
 * decides what happens relative to the conditions already present on the base expression.
 * </p>
 *
 * @since 1.0.0
 */
public enum GroupingMode {

    /**
     * The new predicates form one disjunction group that is AND'ed with whatever the base
     * expression already filters on. Successive compositions narrow the result:
     * {@code (prior conditions) AND (p1 OR p2 OR ...)}. This is the default.
     */
    AND_NEW_GROUP,

    /**
     * The new predicates are OR'ed into the most recent clause of the base expression, widening it:
     * {@code ... AND (last clause OR p1 OR p2 OR ...)}. On a base expression without conditions
     * this is identical to {@link #AND_NEW_GROUP}.
     */
    OR_INTO_LAST_GROUP
}
