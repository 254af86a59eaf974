package com.neptune.query.api.warnings;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits user-visible warnings without flooding the log on heavy workloads.
 *
 * <p>Holds the "already warned" state explicitly: one registry is owned by a client and shared
 * by its workers, so separate clients (and separate tests) never see each other's history.
 */
public class WarningRegistry {

    private static final Logger warningLogger = LoggerFactory.getLogger("NeptuneWarnings");

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(1);

    private final Clock clock;
    private final Duration window;

    private final Set<String> emittedMessages = new HashSet<>();
    private final Map<WarningCategory, Instant> silencedUntil = new EnumMap<>(WarningCategory.class);
    private final Map<WarningCategory, Integer> emittedCounts = new EnumMap<>(WarningCategory.class);

    public WarningRegistry() {
        this(Clock.systemUTC(), DEFAULT_WINDOW);
    }

    public WarningRegistry(Clock clock, Duration window) {
        this.clock = clock;
        this.window = window;
    }

    /**
     * Logs the warning unless its category's throttle suppresses it.
     *
     * @return true if the warning was emitted
     */
    public synchronized boolean warn(WarningCategory category, String message) {
        switch (category.getThrottle()) {
            case ONCE_PER_MESSAGE:
                if (!emittedMessages.add(category.name() + ":" + message)) {
                    return false;
                }
                break;
            case ONCE_PER_WINDOW:
                Instant now = clock.instant();
                Instant until = silencedUntil.get(category);
                if (until != null && until.isAfter(now)) {
                    return false;
                }
                silencedUntil.put(category, now.plus(window));
                break;
            default:
                break;
        }

        emittedCounts.merge(category, 1, Integer::sum);
        warningLogger.warn("[{}] {}", category, message);
        return true;
    }

    /** Number of warnings of the category that were actually emitted. */
    public synchronized int getEmittedCount(WarningCategory category) {
        return emittedCounts.getOrDefault(category, 0);
    }
}
