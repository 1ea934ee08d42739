package io.github.cyfko.fuzzycast.spring.service.impl;

import io.github.cyfko.fuzzycast.core.FuzzyCast;
import io.github.cyfko.fuzzycast.core.model.CompositionOptions;
import io.github.cyfko.fuzzycast.core.model.SearchExpression;
import io.github.cyfko.fuzzycast.jpa.JpaSearchQueries;
import io.github.cyfko.fuzzycast.spring.service.FuzzySearchService;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link FuzzySearchService} opening a short-lived {@link EntityManager} per query.
 */
public class FuzzySearchServiceImpl implements FuzzySearchService {

    private static final Logger logger = Logger.getLogger(FuzzySearchServiceImpl.class.getName());

    private final FuzzyCast fuzzyCast;
    private final EntityManagerFactory emf;

    public FuzzySearchServiceImpl(FuzzyCast fuzzyCast, EntityManagerFactory emf) {
        this.fuzzyCast = Objects.requireNonNull(fuzzyCast, "fuzzyCast cannot be null");
        this.emf = Objects.requireNonNull(emf, "emf cannot be null");
    }

    @Override
    public <E> List<E> search(Class<E> entityType, Object terms) {
        return search(entityType, terms, CompositionOptions.none());
    }

    @Override
    public <E> List<E> search(Class<E> entityType, Object terms, CompositionOptions options) {
        return search(entityType, fuzzyCast.compose(entityType, terms, options));
    }

    @Override
    public <E> List<E> search(Class<E> entityType, SearchExpression expression) {
        long startTime = System.nanoTime();

        EntityManager em = emf.createEntityManager();
        try {
            List<E> results = em.createQuery(JpaSearchQueries.select(em.getCriteriaBuilder(), entityType, expression))
                    .getResultList();

            long durationMs = (System.nanoTime() - startTime) / 1_000_000;
            logger.fine(() -> String.format("Search over %s completed in %dms: %d matches",
                    entityType.getSimpleName(), durationMs, results.size()));
            return results;
        } finally {
            em.close();
        }
    }

    @Override
    public long count(Class<?> entityType, Object terms) {
        return count(fuzzyCast.compose(entityType, terms));
    }

    @Override
    public long count(SearchExpression expression) {
        EntityManager em = emf.createEntityManager();
        try {
            Long count = em.createQuery(JpaSearchQueries.count(em.getCriteriaBuilder(), expression)).getSingleResult();
            logger.fine(() -> String.format("Count over %s: %d matches",
                    expression.getEntityType().getSimpleName(), count));
            return count;
        } finally {
            em.close();
        }
    }
}
