package io.github.cyfko.fuzzycast.core.impl;

import io.github.cyfko.fuzzycast.core.api.SchemaMetadata;

import java.util.List;
import java.util.Objects;

/**
 * Decides which fields search terms are matched against.
 * <p>
 * The candidates are the caller's allowlist when one is given (in the caller's order), otherwise
 * every schema field in declaration order. Fields whose name contains {@value #PROTECTED_FIELD_MARKER}
 * are always removed, even when explicitly requested. Allowlisted names unknown to the schema are
 * kept here and dropped by the caster.
 * </p>
 */
public final class FieldEligibilityResolver {

    /** Case-sensitive marker of fields that are never searchable. */
    public static final String PROTECTED_FIELD_MARKER = "password";

    private FieldEligibilityResolver() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * @param schema the searched schema
     * @param fieldFilter the caller's allowlist, or {@code null} for every schema field
     * @return the eligible fields, possibly empty
     */
    public static List<String> resolve(SchemaMetadata schema, List<String> fieldFilter) {
        Objects.requireNonNull(schema, "schema cannot be null");
        List<String> candidates = fieldFilter != null ? fieldFilter : schema.fields();

        return candidates.stream()
                .filter(field -> !isProtected(field))
                .toList();
    }

    public static boolean isProtected(String field) {
        return field.contains(PROTECTED_FIELD_MARKER);
    }
}
