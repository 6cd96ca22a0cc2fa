package io.doat4j.core;

/**
 * Result of a schedule request.
 *
 * job     : the persisted job, null when rejected
 * message : reply text for the requester
 */
public record ScheduleResult(
        Job job,
        String message
) {

    public static ScheduleResult scheduled(Job job) {
        return new ScheduleResult(job, Replies.scheduled(job));
    }

    public static ScheduleResult rejected(String message) {
        return new ScheduleResult(null, message);
    }

    public boolean isScheduled() {
        return job != null;
    }
}
