package io.github.cyfko.fuzzycast.core.utils;

import io.github.cyfko.fuzzycast.core.config.EnumMatchMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CastResultTest {

    @Test
    @DisplayName("Should expose the value of a success")
    void shouldExposeSuccessValue() {
        CastResult<Integer> result = CastResult.success(42);

        assertTrue(result.isSuccess());
        assertEquals(42, result.getValue());
        assertNull(result.getErrorMessage());
    }

    @Test
    @DisplayName("Should refuse to expose a value on failure")
    void shouldRefuseValueOnFailure() {
        CastResult<Integer> result = CastResult.failure("not a number");

        assertFalse(result.isSuccess());
        assertEquals("not a number", result.getErrorMessage());
        assertThrows(IllegalStateException.class, result::getValue);
    }

    @Test
    @DisplayName("Should map successes and propagate failures")
    void shouldMap() {
        assertEquals("42!", CastResult.success(42).map(v -> v + "!").getValue());

        CastResult<String> failed = CastResult.<Integer>failure("boom").map(v -> v + "!");
        assertFalse(failed.isSuccess());
        assertEquals("boom", failed.getErrorMessage());
    }

    @Test
    @DisplayName("Should build a deferred failure reason only when it is read")
    void shouldDeferFailureReason() {
        AtomicInteger built = new AtomicInteger();

        CastResult<String> failed = CastResult.<Integer>failure(() -> "built " + built.incrementAndGet())
                .map(v -> v + "!");

        assertFalse(failed.isSuccess());
        assertEquals(0, built.get());
        assertEquals("built 1", failed.getErrorMessage());
    }

    @Test
    @DisplayName("Should report conversion failures lazily")
    void shouldReportConversionFailuresLazily() {
        CastResult<Object> result = TypeConversionUtils.tryConvert(Integer.class, "gmail",
                EnumMatchMode.CASE_INSENSITIVE);

        assertFalse(result.isSuccess());
        assertTrue(result.getErrorMessage().startsWith("Cannot convert 'gmail' to Integer"));
    }
}
