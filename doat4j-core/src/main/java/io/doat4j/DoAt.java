package io.doat4j;

import io.doat4j.core.CancelResult;
import io.doat4j.core.DeliveryException;
import io.doat4j.core.Job;
import io.doat4j.core.ScheduleRequest;
import io.doat4j.core.ScheduleResult;

import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>Every tenant owns an independent, durably persisted job set and a single wake time. Jobs are
 * delivered once their due time has passed, at the next wake:
 * <ul>
 *   <li>one-off jobs are removed after delivery</li>
 *   <li>daily jobs are moved to their next future daily slot (missed days are skipped)</li>
 * </ul>
 */
public interface DoAt {
    void start();

    void stop();

    /**
     * Whether the wake runner is currently running. It may stop on its own after repeated
     * storage failures.
     */
    boolean isStarted();

    /**
     * Validate and persist a new job, then point the tenant's wake at the earliest job.
     * Validation problems are reported through {@link ScheduleResult#rejected(String)}.
     */
    ScheduleResult schedule(ScheduleRequest request);

    /**
     * Jobs of a tenant, earliest first.
     */
    List<Job> list(String tenantId);

    CancelResult cancel(String tenantId, String jobId);

    /**
     * Deliver everything currently due for the tenant.
     *
     * <p>Never runs concurrently with another wake of the same tenant; when one is already in
     * progress this returns 0 without sending.
     *
     * @return number of messages sent by this invocation
     */
    int wake(String tenantId) throws DeliveryException;
}
