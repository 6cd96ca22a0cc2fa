package io.doat4j.internal;

import io.doat4j.TenantStorage;
import io.doat4j.core.Job;
import io.doat4j.core.JobSet;
import io.doat4j.core.JobSetMutation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test storage: one synchronized map per value with a revision per job set, and a hook to fail
 * job-set writes.
 */
class InMemoryTenantStorage implements TenantStorage {

    private final Map<String, List<Job>> jobs = new HashMap<>();
    private final Map<String, Long> revisions = new HashMap<>();
    private final Map<String, Map<String, Long>> delivered = new HashMap<>();
    private int failingUpdates;
    private int deliveredWrites;

    @Override
    public synchronized JobSet loadJobSet(String tenantId) {
        return new JobSet(jobs.getOrDefault(tenantId, List.of()), revision(tenantId));
    }

    @Override
    public synchronized <R> R updateJobs(String tenantId, JobSetMutation<R> mutation) {
        if (failingUpdates > 0) {
            failingUpdates--;
            throw new IllegalStateException("simulated storage outage");
        }
        List<Job> current = jobs.getOrDefault(tenantId, List.of());
        List<Job> working = new ArrayList<>(current);
        R result = mutation.apply(working);
        if (!working.equals(current)) {
            write(tenantId, working);
        }
        return result;
    }

    @Override
    public synchronized Map<String, Long> loadDelivered(String tenantId) {
        return new LinkedHashMap<>(delivered.getOrDefault(tenantId, Map.of()));
    }

    @Override
    public synchronized void saveDelivered(String tenantId, Map<String, Long> value) {
        deliveredWrites++;
        delivered.put(tenantId, new LinkedHashMap<>(value));
    }

    /**
     * Overwrite the persisted job set verbatim, keeping the given order.
     */
    synchronized void seed(String tenantId, List<Job> value) {
        write(tenantId, value);
    }

    synchronized long revision(String tenantId) {
        return revisions.getOrDefault(tenantId, 0L);
    }

    private void write(String tenantId, List<Job> value) {
        jobs.put(tenantId, List.copyOf(value));
        revisions.merge(tenantId, 1L, Long::sum);
    }

    synchronized void failNextUpdates(int count) {
        this.failingUpdates = count;
    }

    synchronized int deliveredWrites() {
        return deliveredWrites;
    }
}
