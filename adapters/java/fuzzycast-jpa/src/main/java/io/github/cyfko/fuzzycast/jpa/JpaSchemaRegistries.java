package io.github.cyfko.fuzzycast.jpa;

import io.github.cyfko.fuzzycast.core.api.SchemaMetadata;
import io.github.cyfko.fuzzycast.core.spi.SchemaRegistry;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.Metamodel;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Builds {@link SchemaRegistry} instances from the JPA metamodel.
 *
 * @since 1.0.0
 */
public final class JpaSchemaRegistries {

    private static final Logger logger = Logger.getLogger(JpaSchemaRegistries.class.getName());

    private JpaSchemaRegistries() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Registers a {@link JpaSchemaMetadata} for every entity of the metamodel.
     *
     * @param metamodel the persistence unit metamodel
     * @return a registry keyed by entity class
     */
    public static SchemaRegistry fromMetamodel(Metamodel metamodel) {
        Objects.requireNonNull(metamodel, "metamodel cannot be null");

        List<SchemaMetadata> schemas = metamodel.getEntities().stream()
                .sorted(Comparator.comparing((EntityType<?> e) -> e.getJavaType().getName()))
                .map(e -> (SchemaMetadata) JpaSchemaMetadata.of(e))
                .toList();

        logger.fine(() -> String.format("Read %d entity schemas from the JPA metamodel", schemas.size()));
        return new SchemaRegistry(schemas);
    }

    /**
     * Shortcut for {@code fromMetamodel(emf.getMetamodel())}.
     *
     * @param emf an open entity manager factory
     * @return a registry keyed by entity class
     */
    public static SchemaRegistry fromEntityManagerFactory(EntityManagerFactory emf) {
        Objects.requireNonNull(emf, "emf cannot be null");
        return fromMetamodel(emf.getMetamodel());
    }
}
