package io.github.cyfko.fuzzycast.jpa;

import io.github.cyfko.fuzzycast.core.api.SchemaMetadata;
import io.github.cyfko.fuzzycast.jpa.utils.ReflectionUtils;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.SingularAttribute;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SchemaMetadata} read from a JPA {@link EntityType}.
 * <p>
 * Only singular basic attributes are searchable: associations, embeddables and element
 * collections have no single column a term could be compared with and are left out.
 * Fields keep the Java declaration order of the entity class, superclass fields first.
 * </p>
 *
 * <pre>{@code
 * EntityType<User> userType = entityManager.getMetamodel().entity(User.class);
 * SchemaMetadata schema = JpaSchemaMetadata.of(userType);
 * schema.fields();          // [id, email, password, name, ...]
 * schema.typeOf("age");     // Optional[class java.lang.Integer]
 * }</pre>
 *
 * @since 1.0.0
 */
public final class JpaSchemaMetadata implements SchemaMetadata {

    private final Class<?> entityType;
    private final Map<String, Class<?>> fieldTypes;
    private final List<String> fields;

    private JpaSchemaMetadata(Class<?> entityType, Map<String, Class<?>> fieldTypes) {
        this.entityType = entityType;
        this.fieldTypes = Collections.unmodifiableMap(fieldTypes);
        this.fields = List.copyOf(fieldTypes.keySet());
    }

    /**
     * Reads the searchable fields of a managed entity.
     *
     * @param entity the metamodel entity type
     * @return the schema of the entity
     */
    public static JpaSchemaMetadata of(EntityType<?> entity) {
        Objects.requireNonNull(entity, "entity cannot be null");
        Class<?> javaType = entity.getJavaType();

        Map<String, Class<?>> basicAttributes = new LinkedHashMap<>();
        for (Attribute<?, ?> attribute : entity.getAttributes()) {
            if (isSearchable(attribute)) {
                basicAttributes.put(attribute.getName(), attribute.getJavaType());
            }
        }

        Map<String, Class<?>> ordered = new LinkedHashMap<>();
        for (String name : ReflectionUtils.declaredFieldNames(javaType)) {
            Class<?> type = basicAttributes.remove(name);
            if (type != null) {
                ordered.put(name, type);
            }
        }

        // attributes without a backing field (property access), in a stable order
        List<String> remaining = new ArrayList<>(basicAttributes.keySet());
        remaining.sort(Comparator.naturalOrder());
        for (String name : remaining) {
            ordered.put(name, basicAttributes.get(name));
        }

        return new JpaSchemaMetadata(javaType, ordered);
    }

    private static boolean isSearchable(Attribute<?, ?> attribute) {
        return attribute instanceof SingularAttribute<?, ?>
                && attribute.getPersistentAttributeType() == Attribute.PersistentAttributeType.BASIC;
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
        return "JpaSchemaMetadata[" + entityType.getSimpleName() + " " + fields + "]";
    }
}
