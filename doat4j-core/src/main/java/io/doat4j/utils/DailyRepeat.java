package io.doat4j.utils;

import io.doat4j.core.Job;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Computes the successor of a daily repeating occurrence.
 * <p>
 * Missed days are skipped: the successor is the first daily slot strictly after {@code now}, so a
 * tenant whose wake was delayed by several days receives one delivery, not a backlog.
 */
public final class DailyRepeat {

    public static final long DAY_SECONDS = Duration.ofDays(1).toSeconds();
    public static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    private DailyRepeat() {
    }

    /**
     * Next occurrence of a repeating job.
     *
     * @param occurrence the occurrence that was just handled
     * @param now        time of computation; the result is strictly after it
     * @return the same job with {@code dueUnix}/{@code dueAtMs} advanced by whole days (at least one)
     */
    public static Job next(Job occurrence, Instant now) {
        Objects.requireNonNull(occurrence, "occurrence must not be null");
        Objects.requireNonNull(now, "now must not be null");

        long nowMs = now.toEpochMilli();
        long days = daysToAdvance(occurrence.dueAtMs(), nowMs);
        return occurrence.withDue(
                occurrence.dueUnix() + days * DAY_SECONDS,
                occurrence.dueAtMs() + days * DAY_MILLIS
        );
    }

    /**
     * Smallest {@code k >= 1} such that {@code dueAtMs + k * day > nowMs}.
     */
    static long daysToAdvance(long dueAtMs, long nowMs) {
        if (nowMs < dueAtMs + DAY_MILLIS) {
            return 1;
        }
        // dueAtMs + k*day > nowMs  <=>  k > (nowMs - dueAtMs) / day
        return Math.floorDiv(nowMs - dueAtMs, DAY_MILLIS) + 1;
    }
}
