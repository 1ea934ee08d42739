package io.github.cyfko.fuzzycast.core.exception;

/**
 * Exception thrown when the schema of an entity type cannot be determined.
 * <p>
 * Composing onto an existing {@link io.github.cyfko.fuzzycast.core.model.SearchExpression} requires
 * the schema of the expression's source entity: without it, neither the eligible fields nor their
 * types are known and the call cannot proceed. This is the only failure the composer surfaces;
 * unknown fields and rejected casts are silently dropped instead.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try {
 *     SearchExpression narrowed = fuzzyCast.compose(previous, "smith");
 * } catch (SchemaResolutionException e) {
 *     logger.warning("Fuzzy search unavailable: " + e.getMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class SchemaResolutionException extends RuntimeException {

    private final Class<?> entityType;

    /**
     * Creates a new SchemaResolutionException for the given entity type.
     *
     * @param entityType the entity type whose schema is missing, may be {@code null}
     * @param message explanation of the failure
     */
    public SchemaResolutionException(Class<?> entityType, String message) {
        super(message);
        this.entityType = entityType;
    }

    /**
     * Returns the entity type whose schema could not be resolved.
     *
     * @return the entity type, or {@code null} if unknown
     */
    public Class<?> getEntityType() {
        return entityType;
    }
}
