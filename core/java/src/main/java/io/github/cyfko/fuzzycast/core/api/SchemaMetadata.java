package io.github.cyfko.fuzzycast.core.api;

import java.util.List;
import java.util.Optional;

/**
 * Read-only description of an entity type: its searchable fields and their declared Java types.
 * <p>
 * This is the only thing the composer needs to know about a record type. It is resolved at
 * composition time (passed explicitly or looked up in a
 * {@link io.github.cyfko.fuzzycast.core.spi.SchemaRegistry}); the composer never reflects on the
 * entity class itself.
 * </p>
 * <p><b>Usage example:</b></p>
 * <pre>{@code
 * SchemaMetadata users = EntitySchema.builder(User.class)
 *     .field("id", Long.class)
 *     .field("email", String.class)
 *     .field("password", String.class)
 *     .build();
 *
 * users.fields();            // [id, email, password]
 * users.typeOf("email");     // Optional[class java.lang.String]
 * users.typeOf("nickname");  // Optional.empty
 * }</pre>
 *
 * <p>Implementations must be immutable and thread-safe.</p>
 *
 * @see io.github.cyfko.fuzzycast.core.model.EntitySchema
 * @since 1.0.0
 */
public interface SchemaMetadata {

    /**
     * Returns the Java type of the described entity. Expressions built over this schema declare
     * it as their source.
     *
     * @return the entity type, never {@code null}
     */
    Class<?> getEntityType();

    /**
     * Returns the field names of the entity, in declaration order.
     *
     * @return an immutable ordered list of field names
     */
    List<String> fields();

    /**
     * Returns the declared value type of a field.
     *
     * @param field the field name
     * @return the declared type, or {@link Optional#empty()} if the field is unknown to this schema
     */
    Optional<Class<?>> typeOf(String field);
}
