package io.github.cyfko.fuzzycast.spring.service;

import io.github.cyfko.fuzzycast.core.model.CompositionOptions;
import io.github.cyfko.fuzzycast.core.model.SearchExpression;

import java.util.List;

/**
 * Runs fuzzy searches against the application's persistence unit.
 * <p>
 * Terms follow the usual composition rules: each term is tried against every eligible field
 * and kept only where it can be cast to the field's type.
 * </p>
 *
 * <pre>{@code
 * List<Customer> hits = fuzzySearchService.search(Customer.class, List.of("gmail", "42"));
 * long total = fuzzySearchService.count(Customer.class, "gmail");
 * }</pre>
 */
public interface FuzzySearchService {

    <E> List<E> search(Class<E> entityType, Object terms);

    <E> List<E> search(Class<E> entityType, Object terms, CompositionOptions options);

    /**
     * Runs an already composed expression.
     *
     * @param entityType the source entity type of the expression
     * @param expression the expression to run
     * @param <E> the entity type
     * @return the matching entities
     */
    <E> List<E> search(Class<E> entityType, SearchExpression expression);

    long count(Class<?> entityType, Object terms);

    long count(SearchExpression expression);
}
