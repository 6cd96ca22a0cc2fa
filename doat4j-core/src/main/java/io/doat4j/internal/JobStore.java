package io.doat4j.internal;

import io.doat4j.TenantStorage;
import io.doat4j.core.Job;
import io.doat4j.core.JobSet;
import io.doat4j.utils.DailyRepeat;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the per-tenant job set. Every mutation goes through the storage transaction so concurrent
 * writers cannot lose each other's updates.
 */
public class JobStore {

    static final Comparator<Job> BY_DUE = Comparator.comparingLong(Job::dueAtMs);

    private final TenantStorage storage;
    private final Clock clock;

    public JobStore(TenantStorage storage, Clock clock) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Outcome of completing a due occurrence.
     *
     * found : false when the occurrence was no longer stored (e.g. canceled meanwhile)
     * next  : the rescheduled occurrence of a daily job, null otherwise
     */
    public record Completion(boolean found, Job next) {
        static final Completion NOT_FOUND = new Completion(false, null);
    }

    public void insert(String tenantId, Job job) {
        Objects.requireNonNull(job, "job must not be null");
        storage.updateJobs(tenantId, jobs -> {
            jobs.add(job);
            jobs.sort(BY_DUE);
            return null;
        });
    }

    /**
     * Remove the current occurrence of a job by id.
     */
    public Optional<Job> remove(String tenantId, String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return storage.updateJobs(tenantId, jobs -> {
            for (int i = 0; i < jobs.size(); i++) {
                if (jobs.get(i).id().equals(jobId)) {
                    Job removed = jobs.remove(i);
                    jobs.sort(BY_DUE);
                    return Optional.of(removed);
                }
            }
            // untouched list: nothing is written
            return Optional.empty();
        });
    }

    /**
     * Remove one exact occurrence without rescheduling it.
     */
    public Optional<Job> removeOccurrence(String tenantId, String jobId, long dueUnix) {
        return storage.updateJobs(tenantId, jobs -> {
            int idx = indexOfOccurrence(jobs, jobId, dueUnix);
            if (idx == -1) {
                return Optional.empty();
            }
            Job removed = jobs.remove(idx);
            jobs.sort(BY_DUE);
            return Optional.of(removed);
        });
    }

    /**
     * Remove a handled occurrence and, for daily jobs, insert its next future occurrence.
     *
     * <p>Matching uses {@code (id, dueUnix)} so an occurrence that another path already moved is
     * left alone.
     */
    public Completion complete(String tenantId, Job occurrence) {
        Objects.requireNonNull(occurrence, "occurrence must not be null");
        return storage.updateJobs(tenantId, jobs -> {
            jobs.sort(BY_DUE);
            int idx = indexOfOccurrence(jobs, occurrence.id(), occurrence.dueUnix());
            if (idx == -1) {
                return Completion.NOT_FOUND;
            }

            Job current = jobs.remove(idx);
            Job next = null;
            if (current.repeatsDaily()) {
                next = DailyRepeat.next(current, clock.instant());
                jobs.add(next);
            }
            jobs.sort(BY_DUE);
            return new Completion(true, next);
        });
    }

    /**
     * Read-only view of the job set, earliest first.
     *
     * <p>Always re-sorted: persisted order is not trusted.
     */
    public List<Job> snapshot(String tenantId) {
        return new ArrayList<>(read(tenantId).jobs());
    }

    /**
     * Sorted job set with the revision it was read at.
     */
    public JobSet read(String tenantId) {
        JobSet persisted = storage.loadJobSet(tenantId);
        List<Job> jobs = new ArrayList<>(persisted.jobs());
        jobs.sort(BY_DUE);
        return new JobSet(jobs, persisted.revision());
    }

    private static int indexOfOccurrence(List<Job> jobs, String jobId, long dueUnix) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).isOccurrence(jobId, dueUnix)) {
                return i;
            }
        }
        return -1;
    }
}
