package io.doat4j;

import java.time.Instant;
import java.util.Optional;

/**
 * Host timer facility: holds at most one wake time per tenant.
 *
 * <p>Implementations guarantee at-least-once invocation of the tenant's wake at or after the
 * requested instant, retrying with backoff when the wake fails.
 *
 * <p>Every write carries the revision of the job set the wake time was computed from. A write is
 * applied only if no write from a newer revision was applied before, so a slow writer holding an
 * old snapshot can never overwrite the wake time of a newer one. Writes of equal revision are
 * applied.
 */
public interface AlarmClock {

    /**
     * Replace the tenant's wake time.
     *
     * @return false when the write was ignored as stale
     */
    boolean setAlarm(String tenantId, Instant at, long revision);

    /**
     * @return false when the write was ignored as stale
     */
    boolean deleteAlarm(String tenantId, long revision);

    Optional<Instant> getAlarm(String tenantId);
}
