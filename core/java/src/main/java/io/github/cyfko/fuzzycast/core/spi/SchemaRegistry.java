package io.github.cyfko.fuzzycast.core.spi;

import io.github.cyfko.fuzzycast.core.api.SchemaMetadata;
import io.github.cyfko.fuzzycast.core.exception.SchemaResolutionException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable lookup of {@link SchemaMetadata} by entity type.
 * <p>
 * The registry is how the composer finds the schema of an expression it is asked to extend:
 * expressions only carry their source entity type. Adapters build registries from their own
 * metadata (for instance the JPA metamodel); applications can also assemble one by hand.
 * </p>
 *
 * <pre>{@code
 * SchemaRegistry registry = SchemaRegistry.of(userSchema, orderSchema);
 * SchemaMetadata users = registry.require(User.class);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class SchemaRegistry {

    private static final SchemaRegistry EMPTY = new SchemaRegistry(Collections.emptyList());

    private final Map<Class<?>, SchemaMetadata> schemasByType;

    /**
     * Creates a registry holding the given schemas.
     *
     * @param schemas the schemas to register
     * @throws IllegalArgumentException if two schemas describe the same entity type
     */
    public SchemaRegistry(Collection<? extends SchemaMetadata> schemas) {
        Map<Class<?>, SchemaMetadata> byType = new LinkedHashMap<>();
        for (SchemaMetadata schema : Objects.requireNonNull(schemas, "schemas cannot be null")) {
            Objects.requireNonNull(schema, "schema cannot be null");
            SchemaMetadata previous = byType.putIfAbsent(schema.getEntityType(), schema);
            if (previous != null) {
                throw new IllegalArgumentException(
                        "Duplicate schema for entity type " + schema.getEntityType().getName());
            }
        }
        this.schemasByType = Collections.unmodifiableMap(byType);
    }

    public static SchemaRegistry of(SchemaMetadata... schemas) {
        return new SchemaRegistry(Arrays.asList(schemas));
    }

    public static SchemaRegistry empty() {
        return EMPTY;
    }

    public Optional<SchemaMetadata> find(Class<?> entityType) {
        return Optional.ofNullable(schemasByType.get(entityType));
    }

    /**
     * Returns the schema registered for an entity type.
     *
     * @param entityType the entity type
     * @return its schema
     * @throws SchemaResolutionException if no schema is registered for {@code entityType}
     */
    public SchemaMetadata require(Class<?> entityType) {
        if (entityType == null) {
            throw new SchemaResolutionException(null, "Cannot resolve a schema without a source entity type");
        }
        SchemaMetadata schema = schemasByType.get(entityType);
        if (schema == null) {
            throw new SchemaResolutionException(entityType,
                    "No schema registered for entity type " + entityType.getName() + ". "
                            + "Registered types: " + schemasByType.keySet().stream().map(Class::getSimpleName).toList());
        }
        return schema;
    }

    public boolean contains(Class<?> entityType) {
        return schemasByType.containsKey(entityType);
    }

    public Collection<SchemaMetadata> schemas() {
        return schemasByType.values();
    }

    public int size() {
        return schemasByType.size();
    }
}
