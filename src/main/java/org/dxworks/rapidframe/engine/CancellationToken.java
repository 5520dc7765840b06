package org.dxworks.rapidframe.engine;

import java.time.Clock;
import java.time.Instant;

/**
 * Lets an interactive caller abort a run. The engine checks it between
 * per-file units of work and before the call-graph phase.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null, Clock.systemUTC());

    private final Instant deadline;
    private final Clock clock;
    private volatile boolean cancelled;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Instant deadline) {
        return withDeadline(deadline, Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        return new CancellationToken(deadline, clock);
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (deadline != null && !clock.instant().isBefore(deadline));
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new AnalysisCancelledException("Analysis cancelled");
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new AnalysisCancelledException("Analysis deadline " + deadline + " passed");
        }
    }
}
