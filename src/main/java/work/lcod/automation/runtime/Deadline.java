package work.lcod.automation.runtime;

import java.time.Duration;

/**
 * Point in time on the monotonic clock, with the budget it was created from for messages.
 */
public final class Deadline {
    private static final Deadline NEVER = new Deadline(Long.MAX_VALUE, null);

    private final long expiresAtNanos;
    private final Duration budget;

    private Deadline(long expiresAtNanos, Duration budget) {
        this.expiresAtNanos = expiresAtNanos;
        this.budget = budget;
    }

    public static Deadline never() {
        return NEVER;
    }

    public static Deadline after(Duration budget) {
        return new Deadline(System.nanoTime() + budget.toNanos(), budget);
    }

    public boolean isBounded() {
        return this != NEVER;
    }

    public boolean isExpired() {
        return isBounded() && System.nanoTime() - expiresAtNanos >= 0;
    }

    /** Time left, never negative; {@code Long.MAX_VALUE} nanoseconds when unbounded. */
    public Duration remaining() {
        if (!isBounded()) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        var left = expiresAtNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    /** The duration this deadline was created with, or null when unbounded. */
    public Duration budget() {
        return budget;
    }

    /** Whichever of the two expires first. */
    public Deadline earliest(Deadline other) {
        if (!other.isBounded()) return this;
        if (!isBounded()) return other;
        return expiresAtNanos - other.expiresAtNanos <= 0 ? this : other;
    }
}
