package com.acme.metadata.extractor.util;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EnvVarsTest {

    @Test
    void shouldPreferExplicitValueOverEnvironment() {
        Map<String, String> env = Map.of("EXTRACTOR_THREADS", "8");

        assertEquals(3, EnvVars.resolveInt(env, 3, "EXTRACTOR_THREADS", 0, 0, 512));
        assertEquals(8, EnvVars.resolveInt(env, null, "EXTRACTOR_THREADS", 0, 0, 512));
        assertEquals(0, EnvVars.resolveInt(Map.of(), null, "EXTRACTOR_THREADS", 0, 0, 512));
    }

    @Test
    void shouldClampValues() {
        assertEquals(512, EnvVars.resolveInt(Map.of(), 10_000, "X", 0, 0, 512));
        assertEquals(1, EnvVars.getIntClamped(Map.of("X", "-5"), "X", 100, 1, 16_384));
    }

    @Test
    void shouldFallBackOnBlankOrMalformedValues() {
        assertEquals(100, EnvVars.getIntClamped(Map.of("X", "  "), "X", 100, 1, 1000));
        assertEquals(100, EnvVars.getIntClamped(Map.of("X", "many"), "X", 100, 1, 1000));
        assertEquals(42, EnvVars.getIntClamped(Map.of("X", " 42 "), "X", 100, 1, 1000));
    }
}
