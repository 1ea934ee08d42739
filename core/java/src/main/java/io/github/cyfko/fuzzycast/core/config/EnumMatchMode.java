package io.github.cyfko.fuzzycast.core.config;

/**
 * How a search term is matched against the constant names of an enum-typed field.
 */
public enum EnumMatchMode {
    /** The term must equal the constant name exactly. */
    CASE_SENSITIVE,
    /** The term is compared to constant names ignoring case. */
    CASE_INSENSITIVE
}
