package io.github.flameyossnowy.skeletal.api.utils;

import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues strictly increasing change timestamps in epoch microseconds.
 *
 * <p>Used for {@code delayed_update_tag} values: two writes observed by the same process never
 * share a tag, even when the wall clock does not advance between them.</p>
 */
public final class ChangeClock {
    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public ChangeClock(@NotNull Clock clock) {
        this.clock = clock;
    }

    public static @NotNull ChangeClock system() {
        return new ChangeClock(Clock.systemUTC());
    }

    public long next() {
        Instant now = clock.instant();
        long micros = now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000L;
        return last.updateAndGet(previous -> Math.max(previous + 1, micros));
    }

    public @NotNull Clock clock() {
        return clock;
    }
}
