package io.github.cyfko.fuzzycast.core.utils;

import io.github.cyfko.fuzzycast.core.config.EnumMatchMode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Coercion of textual search terms into the declared Java types of entity fields.
 * <p>
 * Search terms always arrive as text. Before a term can be compared with a field it has to be
 * converted into that field's type, and a term that does not look like a valid value for the type
 * must be rejected rather than approximated: {@code "gmail"} is not an {@code Integer}, nor a
 * {@code Boolean}. Rejections are reported as {@link CastResult#failure(String)}, never thrown.
 * </p>
 *
 * <h2>Supported Target Types</h2>
 * <dl>
 *   <dt><strong>Text</strong></dt>
 *   <dd>{@code String} and any {@code CharSequence} supertype: the term is passed through.</dd>
 *
 *   <dt><strong>Numeric Types</strong></dt>
 *   <dd>
 *     Primitives and wrappers (int, long, short, byte, double, float), BigDecimal, BigInteger.
 *     Integral types accept only integral literals; floating types reject NaN and infinities.
 *   </dd>
 *
 *   <dt><strong>Boolean</strong></dt>
 *   <dd>
 *     Strict, case-insensitive: "true", "1", "yes", "y" and "false", "0", "no", "n".
 *     Anything else is rejected.
 *   </dd>
 *
 *   <dt><strong>Enum Types</strong></dt>
 *   <dd>Constant name, matched according to {@link EnumMatchMode}.</dd>
 *
 *   <dt><strong>Other Types</strong></dt>
 *   <dd>
 *     UUID and the ISO-8601 forms of LocalDate, LocalDateTime, LocalTime, Instant,
 *     OffsetDateTime and ZonedDateTime. Every other type rejects all terms.
 *   </dd>
 * </dl>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * TypeConversionUtils.tryConvert(Long.class, "42", EnumMatchMode.CASE_INSENSITIVE);     // success(42L)
 * TypeConversionUtils.tryConvert(Long.class, "gmail", EnumMatchMode.CASE_INSENSITIVE);  // failure
 * TypeConversionUtils.tryConvert(Status.class, "active", EnumMatchMode.CASE_INSENSITIVE); // success(ACTIVE)
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>All methods are stateless and thread-safe.</p>
 *
 * @since 1.0.0
 * @see EnumMatchMode
 */
public final class TypeConversionUtils {

    private static final Set<String> TRUE_LITERALS = Set.of("true", "1", "yes", "y");
    private static final Set<String> FALSE_LITERALS = Set.of("false", "0", "no", "n");

    private TypeConversionUtils() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    // ========================================
    // PUBLIC API
    // ========================================

    /**
     * Attempts to convert a textual term into the given target type.
     *
     * @param targetType the declared type of the field
     * @param text the search term
     * @param enumMatchMode how enum constant names are matched
     * @return the converted value, or a failure describing why the term was rejected
     */
    public static CastResult<Object> tryConvert(Class<?> targetType, String text, EnumMatchMode enumMatchMode) {
        if (targetType == null) {
            return CastResult.failure("Unknown target type");
        }
        if (text == null) {
            return CastResult.failure(() -> "Cannot convert a null term to " + targetType.getSimpleName());
        }

        try {
            return CastResult.success(convert(targetType, text, enumMatchMode));
        } catch (IllegalArgumentException | DateTimeParseException | ArithmeticException e) {
            return CastResult.failure(() -> String.format("Cannot convert '%s' to %s: %s",
                    text, targetType.getSimpleName(), e.getMessage()));
        }
    }

    /**
     * Whether values of the given type are matched as text (substring match) rather than by equality.
     *
     * @param type a declared field type
     * @return {@code true} for {@code String} and its {@code CharSequence} supertypes
     */
    public static boolean isText(Class<?> type) {
        return type != null && type.isAssignableFrom(String.class) && CharSequence.class.isAssignableFrom(type);
    }

    // ========================================
    // INTERNAL: Dispatch
    // ========================================

    private static Object convert(Class<?> targetType, String text, EnumMatchMode enumMatchMode) {
        if (isText(targetType)) return text;

        // BigDecimal/BigInteger first (before numeric check)
        if (targetType == BigDecimal.class) return new BigDecimal(text);
        if (targetType == BigInteger.class) return new BigInteger(text);

        if (Number.class.isAssignableFrom(targetType) || isNumericPrimitive(targetType)) {
            return convertToNumeric(targetType, text);
        }

        if (targetType.isEnum()) return convertToEnum(targetType, text, enumMatchMode);

        if (targetType == Boolean.class || targetType == boolean.class) return convertToBoolean(text);

        if (targetType == UUID.class) return UUID.fromString(text);

        if (targetType == LocalDate.class) return LocalDate.parse(text);
        if (targetType == LocalDateTime.class) return LocalDateTime.parse(text);
        if (targetType == LocalTime.class) return LocalTime.parse(text);
        if (targetType == Instant.class) return Instant.parse(text);
        if (targetType == OffsetDateTime.class) return OffsetDateTime.parse(text);
        if (targetType == ZonedDateTime.class) return ZonedDateTime.parse(text);

        throw new IllegalArgumentException("Unsupported target type " + targetType.getName());
    }

    private static boolean isNumericPrimitive(Class<?> type) {
        return type == int.class || type == long.class || type == double.class
                || type == float.class || type == short.class || type == byte.class;
    }

    // ========================================
    // INTERNAL: Numeric Conversions
    // ========================================

    private static Object convertToNumeric(Class<?> targetType, String text) {
        if (targetType == Integer.class || targetType == int.class) return Integer.valueOf(text);
        if (targetType == Long.class || targetType == long.class) return Long.valueOf(text);
        if (targetType == Short.class || targetType == short.class) return Short.valueOf(text);
        if (targetType == Byte.class || targetType == byte.class) return Byte.valueOf(text);

        // Parsed through BigDecimal so that "NaN", "Infinity", "1d" or hex literals are rejected
        double parsed = new BigDecimal(text).doubleValue();
        if (targetType == Double.class || targetType == double.class) {
            return requireFinite(parsed, text);
        }
        if (targetType == Float.class || targetType == float.class) {
            return (float) requireFinite((float) parsed, text);
        }

        throw new IllegalArgumentException("Unsupported numeric type: " + targetType.getName());
    }

    private static double requireFinite(double value, String text) {
        if (Double.isInfinite(value)) {
            throw new IllegalArgumentException("Value out of range: " + text);
        }
        return value;
    }

    // ========================================
    // INTERNAL: Enum Conversion
    // ========================================

    @SuppressWarnings("unchecked")
    private static <E extends Enum<E>> E convertToEnum(Class<?> targetType, String text, EnumMatchMode enumMatchMode) {
        Class<E> enumClass = (Class<E>) targetType;

        for (E constant : enumClass.getEnumConstants()) {
            if (constant.name().equals(text)) {
                return constant;
            }
        }

        if (enumMatchMode == EnumMatchMode.CASE_INSENSITIVE) {
            for (E constant : enumClass.getEnumConstants()) {
                if (constant.name().equalsIgnoreCase(text)) {
                    return constant;
                }
            }
        }

        throw new IllegalArgumentException(
                String.format("Invalid value '%s' for enum %s (mode: %s)",
                        text, enumClass.getSimpleName(), enumMatchMode)
        );
    }

    // ========================================
    // INTERNAL: Boolean Conversion
    // ========================================

    private static Boolean convertToBoolean(String text) {
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (TRUE_LITERALS.contains(normalized)) return Boolean.TRUE;
        if (FALSE_LITERALS.contains(normalized)) return Boolean.FALSE;
        throw new IllegalArgumentException("Not a boolean literal: " + text);
    }
}
