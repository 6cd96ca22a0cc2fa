package io.doat4j.internal;

import io.doat4j.Messenger;
import io.doat4j.TenantStorage;
import io.doat4j.core.DeliveryException;
import io.doat4j.core.Job;
import io.doat4j.core.JobKind;
import io.doat4j.core.RenderedMessage;
import io.doat4j.core.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs on every wake of a tenant and drains all occurrences that are due.
 *
 * <p>Delivery is exactly-effectively-once on top of at-least-once wakes:
 * <ol>
 *   <li>a successful send is recorded in the dedup cache, and the cache persisted, before the job
 *       set is touched</li>
 *   <li>the occurrence is then removed (or moved to its next day) in its own transaction</li>
 * </ol>
 * A crash between the two leaves an occurrence that is still stored but already marked; the next
 * wake skips the send and only completes it.
 *
 * <p>At most one drain per tenant runs in this engine at a time; a wake that arrives while one is
 * running returns without sending. Hosts running several engines must serialize wakes themselves
 * (the Mongo runner does so with the alarm claim).
 */
public class DeliveryEngine {
    private static final Logger log = LoggerFactory.getLogger(DeliveryEngine.class);

    private final TenantStorage storage;
    private final JobStore jobStore;
    private final AlarmCoordinator alarmCoordinator;
    private final Messenger messenger;
    private final Clock clock;
    private final Duration dedupRetention;
    private final Set<String> draining = ConcurrentHashMap.newKeySet();

    public DeliveryEngine(TenantStorage storage,
                          JobStore jobStore,
                          AlarmCoordinator alarmCoordinator,
                          Messenger messenger,
                          Clock clock,
                          Duration dedupRetention) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.alarmCoordinator = Objects.requireNonNull(alarmCoordinator, "alarmCoordinator must not be null");
        this.messenger = Objects.requireNonNull(messenger, "messenger must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.dedupRetention = Objects.requireNonNull(dedupRetention, "dedupRetention must not be null");
    }

    /**
     * Deliver every occurrence due now, then point the wake at the next job.
     *
     * <p>On a failed send the current invocation is aborted; occurrences already completed stay
     * completed and the failed one is left in place for the retried wake.
     *
     * @return number of messages sent, 0 when another drain of the tenant is already running
     */
    public int onAlarm(String tenantId) throws DeliveryException {
        Objects.requireNonNull(tenantId, "tenantId must not be null");

        if (!draining.add(tenantId)) {
            log.debug("doat wake already running tenant={}", tenantId);
            return 0;
        }
        try {
            return drain(tenantId);
        } finally {
            draining.remove(tenantId);
        }
    }

    private int drain(String tenantId) throws DeliveryException {
        DedupCache delivered = new DedupCache(storage.loadDelivered(tenantId), dedupRetention);
        delivered.prune(nowMs());

        int sent = 0;
        int skipped = 0;
        while (true) {
            long nowMs = nowMs();

            // Always the latest persisted jobs, never a local copy.
            List<Job> jobs = jobStore.snapshot(tenantId);
            if (jobs.isEmpty() || jobs.get(0).dueAtMs() > nowMs) {
                break;
            }

            Job job = jobs.get(0);
            Optional<JobKind> kind = job.resolveKind();
            if (kind.isEmpty()) {
                // Unknown kind: drop it so it cannot block the wake forever.
                jobStore.removeOccurrence(tenantId, job.id(), job.dueUnix());
                log.warn("doat purged job with unknown kind tenant={} id={} kind={} dueUnix={}",
                        tenantId, job.id(), job.kind(), job.dueUnix());
                continue;
            }

            String key = job.occurrenceKey();
            if (delivered.isDelivered(key)) {
                skipped++;
                log.debug("doat occurrence already delivered tenant={} key={}", tenantId, key);
            } else {
                deliver(tenantId, job, kind.get(), delivered);
                sent++;
            }

            JobStore.Completion completion = jobStore.complete(tenantId, job);
            if (!completion.found()) {
                log.debug("doat occurrence vanished before completion tenant={} key={}", tenantId, key);
            } else if (completion.next() != null) {
                log.debug("doat job rescheduled tenant={} id={} nextDueUnix={}",
                        tenantId, job.id(), completion.next().dueUnix());
            }
        }

        delivered.prune(nowMs());
        storage.saveDelivered(tenantId, delivered.snapshot());

        alarmCoordinator.resync(tenantId);

        if (sent > 0 || skipped > 0) {
            log.info("doat wake finished tenant={} sent={} skipped={}", tenantId, sent, skipped);
        }
        return sent;
    }

    private void deliver(String tenantId, Job job, JobKind kind, DedupCache delivered) throws DeliveryException {
        RenderedMessage message = kind.render(job);

        SendResult result;
        try {
            result = messenger.send(job.channelId(), message.content(), message.mentions());
        } catch (RuntimeException e) {
            persistAsIs(tenantId, delivered);
            throw new DeliveryException(job, e);
        }

        if (result == null || !result.ok()) {
            SendResult failure = result != null ? result : SendResult.failure(-1, "no result");
            persistAsIs(tenantId, delivered);
            throw new DeliveryException(job, failure);
        }

        // Mark before touching the job set: a crash from here on yields a skipped duplicate at most.
        long at = nowMs();
        delivered.markDelivered(job.occurrenceKey(), at);
        delivered.prune(at);
        storage.saveDelivered(tenantId, delivered.snapshot());

        log.debug("doat job delivered tenant={} id={} kind={} dueUnix={}",
                tenantId, job.id(), kind.key(), job.dueUnix());
    }

    private void persistAsIs(String tenantId, DedupCache delivered) {
        delivered.prune(nowMs());
        storage.saveDelivered(tenantId, delivered.snapshot());
    }

    private long nowMs() {
        return clock.millis();
    }
}
