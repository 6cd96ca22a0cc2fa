package io.doat4j.internal;

import io.doat4j.AlarmClock;
import io.doat4j.Messenger;
import io.doat4j.TenantStorage;
import io.doat4j.core.CancelResult;
import io.doat4j.core.DeliveryException;
import io.doat4j.core.Job;
import io.doat4j.core.JobKind;
import io.doat4j.core.Replies;
import io.doat4j.core.ScheduleRequest;
import io.doat4j.core.ScheduleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Storage-agnostic scheduler operations: schedule, list, cancel and wake.
 *
 * <p>Each mutation runs as a storage transaction and is followed by an alarm resync from the
 * persisted state.
 */
public class TenantScheduler {
    private static final Logger log = LoggerFactory.getLogger(TenantScheduler.class);

    private final JobStore jobStore;
    private final AlarmCoordinator alarmCoordinator;
    private final DeliveryEngine deliveryEngine;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public TenantScheduler(TenantStorage storage,
                           AlarmClock alarmClock,
                           Messenger messenger,
                           Clock clock,
                           Duration dedupRetention) {
        this(storage, alarmClock, messenger, clock, dedupRetention, () -> UUID.randomUUID().toString());
    }

    public TenantScheduler(TenantStorage storage,
                           AlarmClock alarmClock,
                           Messenger messenger,
                           Clock clock,
                           Duration dedupRetention,
                           Supplier<String> idGenerator) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
        this.jobStore = new JobStore(storage, clock);
        this.alarmCoordinator = new AlarmCoordinator(jobStore, alarmClock);
        this.deliveryEngine = new DeliveryEngine(storage, jobStore, alarmCoordinator, messenger, clock, dedupRetention);
    }

    public ScheduleResult schedule(ScheduleRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        Optional<JobKind> kind = JobKind.fromKey(request.kind());
        if (kind.isEmpty()) {
            return ScheduleResult.rejected(Replies.INVALID_KIND);
        }

        Optional<String> subjectError = kind.get().validateSubject(request.subject());
        if (subjectError.isPresent()) {
            return ScheduleResult.rejected(subjectError.get());
        }

        long dueUnix = request.dueUnix();
        long nowUnix = Math.floorDiv(clock.millis(), 1000L);
        if (dueUnix <= nowUnix) {
            return ScheduleResult.rejected(Replies.PAST_TIMESTAMP);
        }

        Job job = Job.of(
                idGenerator.get(),
                request.tenantId(),
                request.channelId(),
                kind.get(),
                request.subject(),
                dueUnix,
                request.repeatsDaily(),
                request.createdBy()
        );

        jobStore.insert(job.tenantId(), job);
        alarmCoordinator.resync(job.tenantId());

        log.info("doat job scheduled tenant={} id={} kind={} dueUnix={} repeatsDaily={}",
                job.tenantId(), job.id(), job.kind(), job.dueUnix(), job.repeatsDaily());
        return ScheduleResult.scheduled(job);
    }

    public List<Job> list(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        return jobStore.snapshot(tenantId);
    }

    public CancelResult cancel(String tenantId, String jobId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        String id = jobId == null ? "" : jobId.trim();
        if (id.isEmpty()) {
            return CancelResult.invalidId();
        }

        Optional<Job> removed = jobStore.remove(tenantId, id);
        if (removed.isEmpty()) {
            return CancelResult.notFound(id);
        }

        alarmCoordinator.resync(tenantId);
        log.info("doat job cancelled tenant={} id={} dueUnix={}", tenantId, id, removed.get().dueUnix());
        return CancelResult.cancelled(removed.get());
    }

    public int wake(String tenantId) throws DeliveryException {
        return deliveryEngine.onAlarm(tenantId);
    }
}
