package com.neptune.query.api.warnings;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class WarningRegistryTest {

    private MutableClock clock;
    private WarningRegistry registry;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        registry = new WarningRegistry(clock, Duration.ofSeconds(60));
    }

    @Test
    public void testExperimentalWarnsOncePerMessage() {
        assertTrue(registry.warn(WarningCategory.EXPERIMENTAL, "feature A is experimental"));
        assertFalse(registry.warn(WarningCategory.EXPERIMENTAL, "feature A is experimental"));
        assertTrue(registry.warn(WarningCategory.EXPERIMENTAL, "feature B is experimental"));

        clock.advance(Duration.ofHours(1));
        assertFalse(registry.warn(WarningCategory.EXPERIMENTAL, "feature A is experimental"));
        assertEquals(2, registry.getEmittedCount(WarningCategory.EXPERIMENTAL));
    }

    @Test
    public void testRateLimitWarnsOncePerWindow() {
        assertTrue(registry.warn(WarningCategory.HTTP_429, "throttled"));
        assertFalse(registry.warn(WarningCategory.HTTP_429, "throttled again, other text"));

        clock.advance(Duration.ofSeconds(59));
        assertFalse(registry.warn(WarningCategory.HTTP_429, "throttled"));

        clock.advance(Duration.ofSeconds(1));
        assertTrue(registry.warn(WarningCategory.HTTP_429, "throttled"));
        assertEquals(2, registry.getEmittedCount(WarningCategory.HTTP_429));
    }

    @Test
    public void testWindowedCategoriesAreIndependent() {
        assertTrue(registry.warn(WarningCategory.HTTP_429, "throttled"));
        assertTrue(registry.warn(WarningCategory.HTTP_5XX, "server error"));
        assertFalse(registry.warn(WarningCategory.HTTP_5XX, "server error"));
        assertEquals(1, registry.getEmittedCount(WarningCategory.HTTP_429));
        assertEquals(1, registry.getEmittedCount(WarningCategory.HTTP_5XX));
    }

    @Test
    public void testGenericAlwaysWarns() {
        for (int i = 0; i < 5; i++) {
            assertTrue(registry.warn(WarningCategory.GENERIC, "same message"));
        }
        assertEquals(5, registry.getEmittedCount(WarningCategory.GENERIC));
    }

    @Test
    public void testRegistriesDoNotShareState() {
        WarningRegistry other = new WarningRegistry(clock, Duration.ofSeconds(60));
        assertTrue(registry.warn(WarningCategory.EXPERIMENTAL, "x"));
        assertTrue(other.warn(WarningCategory.EXPERIMENTAL, "x"));
    }
}
