package io.doat4j.core;

import java.util.List;

/**
 * Read-modify-write step applied to a tenant's job set inside a storage transaction.
 */
@FunctionalInterface
public interface JobSetMutation<R> {

    R apply(List<Job> jobs);
}
