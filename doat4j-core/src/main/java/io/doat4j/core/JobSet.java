package io.doat4j.core;

import java.util.List;

/**
 * A tenant's persisted jobs together with the revision they were read at.
 *
 * <p>The revision grows with every persisted change of the job set and is 0 for a tenant that was
 * never written.
 */
public record JobSet(List<Job> jobs, long revision) {

    public JobSet {
        jobs = List.copyOf(jobs);
    }

    public static JobSet empty() {
        return new JobSet(List.of(), 0L);
    }
}
