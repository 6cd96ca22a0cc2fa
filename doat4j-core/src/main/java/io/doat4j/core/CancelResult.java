package io.doat4j.core;

/**
 * Result of canceling a job.
 *
 * jobId   : the requested id (trimmed)
 * removed : the job that was removed, null when nothing matched
 * message : reply text for the requester
 */
public record CancelResult(
        String jobId,
        Job removed,
        String message
) {

    public static CancelResult cancelled(Job removed) {
        return new CancelResult(removed.id(), removed, Replies.cancelled(removed));
    }

    public static CancelResult notFound(String jobId) {
        return new CancelResult(jobId, null, Replies.notFound(jobId));
    }

    public static CancelResult invalidId() {
        return new CancelResult("", null, Replies.INVALID_JOB_ID);
    }

    public boolean hasEffect() {
        return removed != null;
    }
}
