package io.doat4j.core;

/**
 * A due occurrence could not be sent. The occurrence stays in the job set and the wake is expected
 * to be retried by the timer facility.
 */
public class DeliveryException extends Exception {

    private final String jobId;
    private final int statusCode;

    public DeliveryException(Job job, SendResult result) {
        super("Delivery failed for job " + job.id() + " status=" + result.statusCode() + ": " + result.body());
        this.jobId = job.id();
        this.statusCode = result.statusCode();
    }

    public DeliveryException(Job job, Throwable cause) {
        super("Delivery failed for job " + job.id() + ": " + cause.getMessage(), cause);
        this.jobId = job.id();
        this.statusCode = -1;
    }

    public String getJobId() {
        return jobId;
    }

    /**
     * Status reported by the messenger, or -1 when the send itself threw.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
