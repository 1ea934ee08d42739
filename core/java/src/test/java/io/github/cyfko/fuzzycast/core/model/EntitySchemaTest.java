package io.github.cyfko.fuzzycast.core.model;

import io.github.cyfko.fuzzycast.core.TestSchemas;
import io.github.cyfko.fuzzycast.core.TestSchemas.User;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EntitySchemaTest {

    @Test
    void shouldKeepDeclarationOrder() {
        assertEquals(List.of("id", "email", "password"), TestSchemas.USER.fields());
        assertEquals(User.class, TestSchemas.USER.getEntityType());
    }

    @Test
    void shouldResolveDeclaredTypes() {
        assertEquals(Optional.of(Integer.class), TestSchemas.USER.typeOf("id"));
        assertEquals(Optional.of(String.class), TestSchemas.USER.typeOf("email"));
        assertEquals(Optional.empty(), TestSchemas.USER.typeOf("nickname"));
    }

    @Test
    void shouldRejectDuplicateFields() {
        EntitySchema.Builder builder = EntitySchema.builder(User.class).field("id", Long.class);

        assertThrows(IllegalArgumentException.class, () -> builder.field("id", Integer.class));
    }

    @Test
    void shouldExposeImmutableFields() {
        assertThrows(UnsupportedOperationException.class, () -> TestSchemas.USER.fields().add("nickname"));
    }
}
