package com.acme.spsc.util;

import com.acme.spsc.queue.RingStrategy;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EnvVarsTest {

    @Test
    void shouldReturnDefaultForMissingOrBlank() {
        Map<String, String> env = Map.of("EMPTY", "   ", "NAME", "  orders ");
        assertEquals("fallback", EnvVars.getOrDefault(env, "MISSING", "fallback"));
        assertEquals("fallback", EnvVars.getOrDefault(env, "EMPTY", "fallback"));
        assertEquals("orders", EnvVars.getOrDefault(env, "NAME", "fallback"));
    }

    @Test
    void shouldClampIntAndFallbackOnMalformed() {
        Map<String, String> env = Map.of(
            "LOW", "-10",
            "HIGH", "9000",
            "OK", "42",
            "BAD", "abc"
        );
        assertEquals(1, EnvVars.getIntClamped(env, "LOW", 10, 1, 100));
        assertEquals(100, EnvVars.getIntClamped(env, "HIGH", 10, 1, 100));
        assertEquals(42, EnvVars.getIntClamped(env, "OK", 10, 1, 100));
        assertEquals(10, EnvVars.getIntClamped(env, "BAD", 10, 1, 100));
        assertEquals(10, EnvVars.getIntClamped(env, "MISSING", 10, 1, 100));
    }

    @Test
    void shouldClampLongAndAcceptWhitespace() {
        Map<String, String> env = Map.of(
            "LOW", "  -5 ",
            "HIGH", " 10000000000 ",
            "OK", " 25 ",
            "BAD", "1.5"
        );
        assertEquals(0L, EnvVars.getLongClamped(env, "LOW", 7L, 0L, 100L));
        assertEquals(100L, EnvVars.getLongClamped(env, "HIGH", 7L, 0L, 100L));
        assertEquals(25L, EnvVars.getLongClamped(env, "OK", 7L, 0L, 100L));
        assertEquals(7L, EnvVars.getLongClamped(env, "BAD", 7L, 0L, 100L));
    }

    @Test
    void shouldParseEnumCaseInsensitivelyWithDashes() {
        Map<String, String> env = Map.of(
            "DASHED", "spin-lock",
            "UPPER", "LOCK_FREE",
            "UNKNOWN", "ring-of-fire"
        );
        assertEquals(RingStrategy.SPIN_LOCK, EnvVars.getEnum(env, "DASHED", RingStrategy.class, RingStrategy.LOCK_FREE));
        assertEquals(RingStrategy.LOCK_FREE, EnvVars.getEnum(env, "UPPER", RingStrategy.class, RingStrategy.SPIN_LOCK));
        assertEquals(RingStrategy.SPIN_LOCK, EnvVars.getEnum(env, "UNKNOWN", RingStrategy.class, RingStrategy.SPIN_LOCK));
        assertEquals(RingStrategy.LOCK_FREE, EnvVars.getEnum(env, "MISSING", RingStrategy.class, RingStrategy.LOCK_FREE));
    }
}
