package io.github.cyfko.fuzzycast.core.impl;

import io.github.cyfko.fuzzycast.core.TestSchemas;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldEligibilityResolverTest {

    @Test
    @DisplayName("Should use every schema field when no filter is given")
    void shouldUseSchemaFields() {
        assertEquals(List.of("id", "email"), FieldEligibilityResolver.resolve(TestSchemas.USER, null));
    }

    @Test
    @DisplayName("Should keep the filter order")
    void shouldKeepFilterOrder() {
        assertEquals(List.of("email", "id"),
                FieldEligibilityResolver.resolve(TestSchemas.USER, List.of("email", "id")));
    }

    @Test
    @DisplayName("Should exclude protected fields even when explicitly requested")
    void shouldExcludeRequestedPassword() {
        assertEquals(List.of("email"),
                FieldEligibilityResolver.resolve(TestSchemas.USER, List.of("password", "email")));
        assertEquals(List.of(),
                FieldEligibilityResolver.resolve(TestSchemas.USER, List.of("password")));
    }

    @Test
    @DisplayName("Should pass through names the schema does not know")
    void shouldPassThroughUnknownNames() {
        assertEquals(List.of("nickname"),
                FieldEligibilityResolver.resolve(TestSchemas.USER, List.of("nickname")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"password", "passwordHash", "old_password", "userpassword"})
    void shouldProtectNamesContainingMarker(String field) {
        assertTrue(FieldEligibilityResolver.isProtected(field));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Password", "PASSWORD", "passcode", "email"})
    void shouldMatchMarkerCaseSensitively(String field) {
        assertFalse(FieldEligibilityResolver.isProtected(field));
    }
}
