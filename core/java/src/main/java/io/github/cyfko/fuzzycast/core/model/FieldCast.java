package io.github.cyfko.fuzzycast.core.model;

import io.github.cyfko.fuzzycast.core.utils.TypeConversionUtils;

import java.util.Objects;

/**
 * A search term successfully coerced into the declared type of one field.
 *
 * @param field the field name
 * @param value the term converted to {@code type}
 * @param type the declared type of the field
 * @since 1.0.0
 */
public record FieldCast(String field, Object value, Class<?> type) {

    public FieldCast {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
    }

    /**
     * Whether the field is text-typed and therefore matched by substring.
     */
    public boolean isText() {
        return TypeConversionUtils.isText(type);
    }
}
