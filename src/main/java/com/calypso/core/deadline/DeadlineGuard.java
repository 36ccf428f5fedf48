package com.calypso.core.deadline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock budget for one build invocation.
 * <p>
 * The cutoff is {@code start + budget - safetyMargin}. Past the cutoff no new model call or
 * verification round may start, and an in-flight model stream is cut off (callers bound it
 * with {@link #timeUntilCutoff()}), so the remaining margin is left for persisting results.
 */
public class DeadlineGuard {

    public static final Duration DEFAULT_BUDGET = Duration.ofSeconds(300);
    public static final Duration DEFAULT_SAFETY_MARGIN = Duration.ofSeconds(30);

    private final Clock clock;
    private final Instant startedAt;
    private final Instant cutoff;

    public DeadlineGuard(Clock clock, Duration budget, Duration safetyMargin) {
        if (budget.isNegative() || safetyMargin.isNegative()) {
            throw new IllegalArgumentException("budget and safety margin must be non-negative");
        }
        if (safetyMargin.compareTo(budget) > 0) {
            throw new IllegalArgumentException("safety margin " + safetyMargin + " exceeds budget " + budget);
        }
        this.clock = clock;
        this.startedAt = clock.instant();
        this.cutoff = startedAt.plus(budget).minus(safetyMargin);
    }

    public static DeadlineGuard startingNow(Duration budget, Duration safetyMargin) {
        return new DeadlineGuard(Clock.systemUTC(), budget, safetyMargin);
    }

    /** True while it is safe to start (or keep) generating or verifying. */
    public boolean canContinue() {
        return clock.instant().isBefore(cutoff);
    }

    public boolean isExpired() {
        return !canContinue();
    }

    /** Time left before the cutoff; {@link Duration#ZERO} once it has passed. */
    public Duration timeUntilCutoff() {
        Duration left = Duration.between(clock.instant(), cutoff);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    public Instant cutoff() {
        return cutoff;
    }
}
