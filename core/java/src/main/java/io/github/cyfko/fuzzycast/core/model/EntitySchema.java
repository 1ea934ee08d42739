package io.github.cyfko.fuzzycast.core.model;

import io.github.cyfko.fuzzycast.core.api.SchemaMetadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Explicitly declared {@link SchemaMetadata}: fields are listed with their types, in order.
 *
 * <pre>{@code
 * SchemaMetadata users = EntitySchema.builder(User.class)
 *     .field("id", Integer.class)
 *     .field("email", String.class)
 *     .field("password", String.class)
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class EntitySchema implements SchemaMetadata {

    private final Class<?> entityType;
    private final Map<String, Class<?>> fieldTypes;
    private final List<String> fields;

    private EntitySchema(Class<?> entityType, Map<String, Class<?>> fieldTypes) {
        this.entityType = entityType;
        this.fieldTypes = Collections.unmodifiableMap(new LinkedHashMap<>(fieldTypes));
        this.fields = List.copyOf(fieldTypes.keySet());
    }

    public static Builder builder(Class<?> entityType) {
        return new Builder(entityType);
    }

    @Override
    public Class<?> getEntityType() {
        return entityType;
    }

    @Override
    public List<String> fields() {
        return fields;
    }

    @Override
    public Optional<Class<?>> typeOf(String field) {
        return Optional.ofNullable(fieldTypes.get(field));
    }

    @Override
    public String toString() {
        return "EntitySchema[" + entityType.getSimpleName() + " " + fieldTypes.keySet() + "]";
    }

    public static final class Builder {
        private final Class<?> entityType;
        private final Map<String, Class<?>> fieldTypes = new LinkedHashMap<>();

        private Builder(Class<?> entityType) {
            this.entityType = Objects.requireNonNull(entityType, "entityType cannot be null");
        }

        /**
         * Declares a field. Fields keep the order in which they are declared.
         *
         * @throws IllegalArgumentException if the field was already declared
         */
        public Builder field(String name, Class<?> type) {
            Objects.requireNonNull(name, "field name cannot be null");
            Objects.requireNonNull(type, "field type cannot be null");
            if (fieldTypes.putIfAbsent(name, type) != null) {
                throw new IllegalArgumentException(
                        "Field '" + name + "' is already declared on " + entityType.getSimpleName());
            }
            return this;
        }

        public EntitySchema build() {
            return new EntitySchema(entityType, fieldTypes);
        }
    }
}
