package io.doat4j.internal;

import io.doat4j.AlarmClock;
import io.doat4j.core.JobSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the tenant's single wake time equal to the earliest persisted due time.
 *
 * <p>The wake time is always derived from a fresh read of the job set, never from a job object an
 * operation captured earlier. The write is tagged with the revision of that read, and the alarm
 * clock drops writes older than one it already holds: when two processes resync the same tenant
 * concurrently, the one that read the newer job set wins whatever order the writes land in.
 */
public class AlarmCoordinator {
    private static final Logger log = LoggerFactory.getLogger(AlarmCoordinator.class);

    private final JobStore jobStore;
    private final AlarmClock alarmClock;

    public AlarmCoordinator(JobStore jobStore, AlarmClock alarmClock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.alarmClock = Objects.requireNonNull(alarmClock, "alarmClock must not be null");
    }

    /**
     * @return the wake time computed from the job set read, empty when it is empty
     */
    public Optional<Instant> resync(String tenantId) {
        JobSet current = jobStore.read(tenantId);
        if (current.jobs().isEmpty()) {
            boolean applied = alarmClock.deleteAlarm(tenantId, current.revision());
            log.debug("doat alarm cleared tenant={} revision={} applied={}", tenantId, current.revision(), applied);
            return Optional.empty();
        }

        Instant next = Instant.ofEpochMilli(current.jobs().get(0).dueAtMs());
        boolean applied = alarmClock.setAlarm(tenantId, next, current.revision());
        log.debug("doat alarm set tenant={} at={} jobs={} revision={} applied={}",
                tenantId, next, current.jobs().size(), current.revision(), applied);
        return Optional.of(next);
    }
}
