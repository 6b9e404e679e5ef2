package com.forgemind.core.evolution;

import com.forgemind.core.model.RunStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag with an optional deadline. Long-running evolution work
 * calls {@link #checkpoint()} between units of work.
 * <p>
 * A child token shares its parent's cancellation flag and never outlives its deadline.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled;
    private final Instant deadline;
    private final Clock clock;

    private CancellationToken(AtomicBoolean cancelled, Instant deadline, Clock clock) {
        this.cancelled = cancelled;
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationToken none() {
        return new CancellationToken(new AtomicBoolean(false), null, Clock.systemUTC());
    }

    /** Token without a deadline that reads time from {@code clock}; children add their own deadlines. */
    public static CancellationToken open(Clock clock) {
        return new CancellationToken(new AtomicBoolean(false), null, clock);
    }

    public static CancellationToken until(Instant deadline, Clock clock) {
        return new CancellationToken(new AtomicBoolean(false), deadline, clock);
    }

    /** Child whose deadline is {@code timeout} from now, measured on this token's clock. */
    public CancellationToken child(Duration timeout) {
        return child(clock.instant().plus(timeout));
    }

    /** Token sharing this token's cancellation flag with the earlier of both deadlines. */
    public CancellationToken child(Instant childDeadline) {
        Instant effective = deadline == null || childDeadline.isBefore(deadline) ? childDeadline : deadline;
        return new CancellationToken(cancelled, effective, clock);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /** Time left before the deadline, or {@code null} when there is none. */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /** Caps {@code budget} at the time remaining. */
    public Duration cap(Duration budget) {
        Duration left = remaining();
        return left == null || budget.compareTo(left) < 0 ? budget : left;
    }

    /**
     * @throws EvolutionInterruptedException when cancelled or past the deadline
     */
    public void checkpoint() {
        if (isCancelled()) {
            throw new EvolutionInterruptedException(RunStatus.CANCELLED, "evolution cancelled");
        }
        if (isExpired()) {
            throw new EvolutionInterruptedException(RunStatus.TIMED_OUT, "evolution deadline " + deadline + " passed");
        }
    }
}
