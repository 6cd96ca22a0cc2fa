package io.doat4j.core;

import java.util.Objects;
import java.util.Optional;

/**
 * One pending occurrence of a scheduled action.
 *
 * <p>{@code id} stays the same across daily reschedules; the occurrence identity is
 * {@code (id, dueUnix)}.
 */
public record Job(

        // identity
        String id,
        String tenantId,
        String channelId,

        // action
        String kind,
        String subject,

        // scheduling
        long dueUnix,
        long dueAtMs,
        boolean repeatsDaily,

        // audit
        String createdBy
) {

    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(channelId, "channelId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
    }

    public static Job of(String id,
                         String tenantId,
                         String channelId,
                         JobKind kind,
                         String subject,
                         long dueUnix,
                         boolean repeatsDaily,
                         String createdBy) {
        return new Job(id, tenantId, channelId, kind.key(), subject, dueUnix, dueUnix * 1000L, repeatsDaily, createdBy);
    }

    /**
     * Key identifying this exact firing, used to make redelivery a no-op.
     */
    public String occurrenceKey() {
        return id + ":" + dueUnix;
    }

    public boolean isOccurrence(String otherId, long otherDueUnix) {
        return id.equals(otherId) && dueUnix == otherDueUnix;
    }

    /**
     * Same job moved to another due time.
     */
    public Job withDue(long nextDueUnix, long nextDueAtMs) {
        return new Job(id, tenantId, channelId, kind, subject, nextDueUnix, nextDueAtMs, repeatsDaily, createdBy);
    }

    /**
     * Empty when the stored kind is not one this version knows how to deliver.
     */
    public Optional<JobKind> resolveKind() {
        return JobKind.fromKey(kind);
    }
}
