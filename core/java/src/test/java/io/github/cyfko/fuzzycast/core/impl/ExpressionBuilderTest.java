package io.github.cyfko.fuzzycast.core.impl;

import io.github.cyfko.fuzzycast.core.TestSchemas.Account;
import io.github.cyfko.fuzzycast.core.TestSchemas.Status;
import io.github.cyfko.fuzzycast.core.api.Condition;
import io.github.cyfko.fuzzycast.core.config.GroupingMode;
import io.github.cyfko.fuzzycast.core.model.FieldCast;
import io.github.cyfko.fuzzycast.core.model.FieldCondition;
import io.github.cyfko.fuzzycast.core.model.SearchExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionBuilderTest {

    private static final FieldCast NAME = new FieldCast("name", "bo_b", String.class);
    private static final FieldCast AGE = new FieldCast("age", 7, Integer.class);
    private static final FieldCast STATUS = new FieldCast("status", Status.ACTIVE, Status.class);

    @Nested
    @DisplayName("Condition per cast")
    class ConditionPerCast {

        @Test
        void textCastsBecomeEscapedContainsMatch() {
            assertEquals(FieldCondition.ilike("name", "%bo\\_b%"), ExpressionBuilder.toCondition(NAME));
        }

        @Test
        void otherCastsBecomeEquality() {
            assertEquals(FieldCondition.equal("age", 7), ExpressionBuilder.toCondition(AGE));
            assertEquals(FieldCondition.equal("status", Status.ACTIVE), ExpressionBuilder.toCondition(STATUS));
        }
    }

    @Nested
    @DisplayName("Grouping")
    class Grouping {

        private final Condition existing = FieldCondition.equal("active", true);
        private final SearchExpression base = SearchExpression.from(Account.class).where(existing);

        @Test
        @DisplayName("Should return the base untouched when nothing was cast")
        void shouldReturnBaseWhenEmpty() {
            assertSame(base, ExpressionBuilder.build(base, List.of(), GroupingMode.AND_NEW_GROUP));
        }

        @Test
        @DisplayName("Should AND one OR group after existing clauses")
        void shouldAppendNewGroup() {
            SearchExpression result = ExpressionBuilder.build(base, List.of(NAME, AGE), GroupingMode.AND_NEW_GROUP);

            assertEquals(List.of(existing, ExpressionBuilder.toCondition(NAME).or(ExpressionBuilder.toCondition(AGE))),
                    result.getClauses());
        }

        @Test
        @DisplayName("Should OR every cast into the last clause")
        void shouldOrIntoLastGroup() {
            SearchExpression result = ExpressionBuilder.build(base, List.of(NAME, AGE), GroupingMode.OR_INTO_LAST_GROUP);

            assertEquals(1, result.getClauses().size());
            assertEquals(existing.or(ExpressionBuilder.toCondition(NAME)).or(ExpressionBuilder.toCondition(AGE)),
                    result.getClauses().get(0));
        }

        @Test
        @DisplayName("Should start a first clause on an unfiltered base in either mode")
        void shouldStartFirstClause() {
            SearchExpression all = SearchExpression.from(Account.class);

            assertEquals(ExpressionBuilder.build(all, List.of(NAME, AGE), GroupingMode.AND_NEW_GROUP),
                    ExpressionBuilder.build(all, List.of(NAME, AGE), GroupingMode.OR_INTO_LAST_GROUP));
        }
    }
}
