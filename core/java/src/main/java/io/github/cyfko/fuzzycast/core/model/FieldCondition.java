package io.github.cyfko.fuzzycast.core.model;

import io.github.cyfko.fuzzycast.core.api.Condition;
import io.github.cyfko.fuzzycast.core.api.Op;

import java.util.Objects;

/**
 * Leaf condition comparing one entity field with a value.
 * <p>
 * For pattern operators ({@link Op#MATCHES}, {@link Op#IMATCHES}) the value is a LIKE pattern
 * using {@code %} and {@code _} as wildcards and {@link #LIKE_ESCAPE} as escape character.
 * For the other operators it is the typed value the field is compared with.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * FieldCondition.equal("id", 42L);                      // id = 42
 * FieldCondition.containsIgnoreCase("email", "gmail");  // email ILIKE '%gmail%'
 * FieldCondition.containsIgnoreCase("code", "50%");     // code ILIKE '%50\%%'
 * }</pre>
 *
 * @param field the entity field name
 * @param op the comparison operator
 * @param value the compared value or pattern, never {@code null}
 * @since 1.0.0
 */
public record FieldCondition(String field, Op op, Object value) implements Condition {

    /** Escape character used in the patterns built by {@link #containsIgnoreCase(String, String)}. */
    public static final char LIKE_ESCAPE = '\\';

    public FieldCondition {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(op, "op cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (field.isBlank()) {
            throw new IllegalArgumentException("field cannot be blank");
        }
        if (op.isPattern() && !(value instanceof String)) {
            throw new IllegalArgumentException(
                    "Operator " + op + " requires a String pattern, got " + value.getClass().getSimpleName());
        }
    }

    public static FieldCondition equal(String field, Object value) {
        return new FieldCondition(field, Op.EQ, value);
    }

    public static FieldCondition notEqual(String field, Object value) {
        return new FieldCondition(field, Op.NE, value);
    }

    public static FieldCondition like(String field, String pattern) {
        return new FieldCondition(field, Op.MATCHES, pattern);
    }

    public static FieldCondition ilike(String field, String pattern) {
        return new FieldCondition(field, Op.IMATCHES, pattern);
    }

    /**
     * Case-insensitive substring match: the field contains {@code text} literally.
     * Wildcards and the escape character inside {@code text} are escaped.
     *
     * @param field the text field
     * @param text the searched substring
     * @return the condition {@code field ILIKE '%text%'}
     */
    public static FieldCondition containsIgnoreCase(String field, String text) {
        return ilike(field, "%" + escapeLike(text) + "%");
    }

    /**
     * Escapes the LIKE wildcards {@code %} and {@code _} and the escape character itself.
     *
     * @param text raw text
     * @return text safe to embed in a LIKE pattern
     */
    public static String escapeLike(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    @Override
    public Condition and(Condition other) {
        return CompositeCondition.combine(CompositeCondition.Kind.ALL, this, other);
    }

    @Override
    public Condition or(Condition other) {
        return CompositeCondition.combine(CompositeCondition.Kind.ANY, this, other);
    }

    @Override
    public Condition not() {
        return new NegatedCondition(this);
    }

    @Override
    public String toString() {
        String rendered = value instanceof CharSequence || value instanceof Enum<?>
                ? "'" + value + "'"
                : String.valueOf(value);
        return field + " " + op.getSymbol() + " " + rendered;
    }
}
