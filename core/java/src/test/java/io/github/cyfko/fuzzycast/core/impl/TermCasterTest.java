package io.github.cyfko.fuzzycast.core.impl;

import io.github.cyfko.fuzzycast.core.TestSchemas;
import io.github.cyfko.fuzzycast.core.TestSchemas.Status;
import io.github.cyfko.fuzzycast.core.api.SchemaMetadata;
import io.github.cyfko.fuzzycast.core.config.EnumMatchMode;
import io.github.cyfko.fuzzycast.core.model.FieldCast;
import io.github.cyfko.fuzzycast.core.utils.CastResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TermCasterTest {

    @Mock
    private SchemaMetadata schema;

    private final TermCaster caster = new TermCaster(EnumMatchMode.CASE_INSENSITIVE);

    @Test
    @DisplayName("Should cast a term to the field's declared type")
    void shouldCastToDeclaredType() {
        CastResult<FieldCast> result = caster.cast(TestSchemas.ACCOUNT, "age", "42");

        assertTrue(result.isSuccess());
        assertEquals(new FieldCast("age", 42, Integer.class), result.getValue());
    }

    @Test
    @DisplayName("Should fail for fields the schema does not declare")
    void shouldFailForUnknownField() {
        CastResult<FieldCast> result = caster.cast(TestSchemas.ACCOUNT, "nickname", "bob");

        assertFalse(result.isSuccess());
        assertTrue(result.getErrorMessage().contains("nickname"));
    }

    @Test
    @DisplayName("Should iterate terms outermost and fields innermost")
    void shouldIterateTermMajor() {
        List<FieldCast> casts = caster.castAll(TestSchemas.ACCOUNT, List.of("7", "active"), List.of("name", "age", "status"));

        assertEquals(List.of(
                new FieldCast("name", "7", String.class),
                new FieldCast("age", 7, Integer.class),
                new FieldCast("name", "active", String.class),
                new FieldCast("status", Status.ACTIVE, Status.class)
        ), casts);
    }

    @Test
    @DisplayName("Should consult the schema for every field and term")
    void shouldConsultSchema() {
        when(schema.typeOf("code")).thenReturn(Optional.of(Long.class));

        List<FieldCast> casts = caster.castAll(schema, List.of("12", "x"), List.of("code"));

        assertEquals(List.of(new FieldCast("code", 12L, Long.class)), casts);
        verify(schema, times(2)).typeOf("code");
    }

    @Test
    @DisplayName("Should not describe rejections nobody reads")
    void shouldNotDescribeUnreadRejections() {
        List<FieldCast> casts = caster.castAll(schema, List.of("bob"), List.of("nickname"));

        assertTrue(casts.isEmpty());
        verify(schema).typeOf("nickname");
        verify(schema, never()).getEntityType();
    }

    @Test
    @DisplayName("Should return nothing when there are no terms or fields")
    void shouldReturnNothingForEmptyInput() {
        assertTrue(caster.castAll(TestSchemas.ACCOUNT, List.of(), List.of("name")).isEmpty());
        assertTrue(caster.castAll(TestSchemas.ACCOUNT, List.of("bob"), List.of()).isEmpty());
    }

    @Test
    void shouldRequireEnumMatchMode() {
        assertThrows(NullPointerException.class, () -> new TermCaster(null));
    }
}
