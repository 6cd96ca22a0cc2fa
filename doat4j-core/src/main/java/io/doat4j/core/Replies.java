package io.doat4j.core;

import java.util.List;
import java.util.stream.Collectors;

/**
 * User-facing reply texts for the request operations.
 *
 * <p>Times are rendered as Discord timestamp markup ({@code <t:UNIX:F>} absolute,
 * {@code <t:UNIX:R>} relative).
 */
public final class Replies {

    public static final String INVALID_KIND = "Invalid target type.";
    public static final String PAST_TIMESTAMP = "That timestamp is in the past.";
    public static final String INVALID_JOB_ID = "Provide a valid `job_id`.";
    public static final String NO_JOBS = "No scheduled jobs.";

    private Replies() {
    }

    public static String scheduled(Job job) {
        return "✅ Scheduled job for " + absolute(job.dueUnix()) + " (" + relative(job.dueUnix()) + ")"
                + (job.repeatsDaily() ? "\n🔁 Repeats daily." : "")
                + "\nJob ID: `" + job.id() + "`";
    }

    public static String cancelled(Job job) {
        return "🗑️ Cancelled job `" + job.id() + "` scheduled for " + absolute(job.dueUnix()) + ".";
    }

    public static String notFound(String jobId) {
        return "No job found: `" + jobId + "`";
    }

    /**
     * Listing of the given jobs (expected earliest first), showing at most {@code limit} lines.
     */
    public static String listing(List<Job> jobs, int limit) {
        if (jobs.isEmpty()) {
            return NO_JOBS;
        }
        String shown = jobs.stream()
                .limit(Math.max(1, limit))
                .map(Replies::line)
                .collect(Collectors.joining("\n"));
        return "📌 Scheduled jobs (" + jobs.size() + " total):\n" + shown;
    }

    private static String line(Job job) {
        String target = job.resolveKind()
                .map(kind -> kind.innerText(job))
                .orElse("(unknown " + job.kind() + ")");
        return "• " + absolute(job.dueUnix()) + " (" + relative(job.dueUnix()) + ") - "
                + target + " in <#" + job.channelId() + ">"
                + (job.repeatsDaily() ? " 🔁 daily" : "")
                + " - id: `" + job.id() + "`";
    }

    private static String absolute(long unix) {
        return "<t:" + unix + ":F>";
    }

    private static String relative(long unix) {
        return "<t:" + unix + ":R>";
    }
}
