package io.github.cyfko.fuzzycast.core.impl;

import io.github.cyfko.fuzzycast.core.api.SchemaMetadata;
import io.github.cyfko.fuzzycast.core.config.EnumMatchMode;
import io.github.cyfko.fuzzycast.core.model.FieldCast;
import io.github.cyfko.fuzzycast.core.utils.CastResult;
import io.github.cyfko.fuzzycast.core.utils.TypeConversionUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Coerces search terms into the declared types of candidate fields.
 * <p>
 * Casting is deliberately permissive: a term that is not a valid value for a field, or a field the
 * schema does not know, simply contributes nothing. Partial success is the normal case, e.g. a
 * term {@code "42"} casts to an {@code Integer} id and to a {@code String} email but not to a
 * {@code Boolean} flag.
 * </p>
 */
public final class TermCaster {

    private static final Logger logger = Logger.getLogger(TermCaster.class.getName());

    private final EnumMatchMode enumMatchMode;

    public TermCaster(EnumMatchMode enumMatchMode) {
        this.enumMatchMode = Objects.requireNonNull(enumMatchMode, "enumMatchMode cannot be null");
    }

    /**
     * Attempts to cast one term against one field.
     *
     * @return the cast, or a failure when the field is unknown or the term does not fit its type
     */
    public CastResult<FieldCast> cast(SchemaMetadata schema, String field, String term) {
        Optional<Class<?>> type = schema.typeOf(field);
        if (type.isEmpty()) {
            return CastResult.failure(() -> String.format("Unknown field '%s' on %s",
                    field, schema.getEntityType().getSimpleName()));
        }
        Class<?> fieldType = type.get();
        return TypeConversionUtils.tryConvert(fieldType, term, enumMatchMode)
                .map(value -> new FieldCast(field, value, fieldType));
    }

    /**
     * Casts every term against every field and keeps the successes.
     *
     * @return casts grouped by term (in term order), each group in field order
     */
    public List<FieldCast> castAll(SchemaMetadata schema, List<String> terms, List<String> fields) {
        List<FieldCast> casts = new ArrayList<>();
        for (String term : terms) {
            for (String field : fields) {
                CastResult<FieldCast> result = cast(schema, field, term);
                if (result.isSuccess()) {
                    casts.add(result.getValue());
                } else {
                    logger.finest(() -> "Dropped term for field '" + field + "': " + result.getErrorMessage());
                }
            }
        }
        return Collections.unmodifiableList(casts);
    }
}
