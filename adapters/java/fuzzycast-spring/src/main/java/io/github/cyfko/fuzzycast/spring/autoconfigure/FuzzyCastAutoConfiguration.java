package io.github.cyfko.fuzzycast.spring.autoconfigure;

import io.github.cyfko.fuzzycast.core.FuzzyCast;
import io.github.cyfko.fuzzycast.core.config.FuzzyCastConfig;
import io.github.cyfko.fuzzycast.core.spi.SchemaRegistry;
import io.github.cyfko.fuzzycast.jpa.JpaSchemaRegistries;
import io.github.cyfko.fuzzycast.spring.service.FuzzySearchService;
import io.github.cyfko.fuzzycast.spring.service.impl.FuzzySearchServiceImpl;
import jakarta.persistence.EntityManagerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnSingleCandidate;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.logging.Logger;

/**
 * Wires a {@link FuzzyCast} whose schemas come from the application's JPA metamodel.
 * <p>
 * Every bean backs off when the application declares its own. Schemas and the search service
 * need a single (or primary) {@link EntityManagerFactory}; with several candidates FuzzyCast
 * starts without entity schemas.
 * </p>
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration")
@ConditionalOnClass(FuzzyCast.class)
@EnableConfigurationProperties(FuzzyCastProperties.class)
public class FuzzyCastAutoConfiguration {

    private static final Logger logger = Logger.getLogger(FuzzyCastAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public SchemaRegistry fuzzyCastSchemaRegistry(ObjectProvider<EntityManagerFactory> entityManagerFactory) {
        EntityManagerFactory emf = entityManagerFactory.getIfUnique();
        if (emf == null) {
            logger.info("No unique EntityManagerFactory found: FuzzyCast starts without entity schemas");
            return SchemaRegistry.empty();
        }

        SchemaRegistry registry = JpaSchemaRegistries.fromEntityManagerFactory(emf);
        logger.info(() -> String.format("FuzzyCast registered %d entity schemas", registry.size()));
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public FuzzyCastConfig fuzzyCastConfig(FuzzyCastProperties properties) {
        return properties.toConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public FuzzyCast fuzzyCast(SchemaRegistry schemaRegistry, FuzzyCastConfig fuzzyCastConfig) {
        return new FuzzyCast(schemaRegistry, fuzzyCastConfig);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnSingleCandidate(EntityManagerFactory.class)
    public FuzzySearchService fuzzySearchService(FuzzyCast fuzzyCast, EntityManagerFactory entityManagerFactory) {
        return new FuzzySearchServiceImpl(fuzzyCast, entityManagerFactory);
    }
}
