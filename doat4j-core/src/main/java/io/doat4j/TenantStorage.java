package io.doat4j;

import io.doat4j.core.Job;
import io.doat4j.core.JobSet;
import io.doat4j.core.JobSetMutation;

import java.util.List;
import java.util.Map;

/**
 * Durable per-tenant storage of the two scheduler values: the job set and the delivered-occurrence
 * cache.
 *
 * <p>Tenants are fully isolated from each other. The job set is only ever modified through
 * {@link #updateJobs(String, JobSetMutation)}, which must behave as an atomic read-modify-write:
 * two racing updates must both be reflected.
 */
public interface TenantStorage {

    /**
     * Current job set as persisted, read in one step with its revision. Order is not guaranteed.
     */
    JobSet loadJobSet(String tenantId);

    default List<Job> loadJobs(String tenantId) {
        return loadJobSet(tenantId).jobs();
    }

    /**
     * Apply a mutation atomically and persist the result.
     *
     * <p>The mutation receives a mutable copy of the current job set. It may be invoked more than
     * once when a concurrent write is detected, so it must not have side effects beyond the list.
     * Nothing is written when the list is left unchanged; every write increments the revision.
     *
     * @return the value returned by the last (successful) invocation of the mutation
     */
    <R> R updateJobs(String tenantId, JobSetMutation<R> mutation);

    /**
     * Delivered occurrence keys mapped to their delivery time in epoch millis.
     */
    Map<String, Long> loadDelivered(String tenantId);

    void saveDelivered(String tenantId, Map<String, Long> delivered);
}
