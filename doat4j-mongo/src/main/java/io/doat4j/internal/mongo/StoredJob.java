package io.doat4j.internal.mongo;

import io.doat4j.core.Job;

/**
 * Embedded Mongo model of one job inside {@link TenantStateDocument#getJobs()}.
 *
 * <p>The id is stored as {@code jobId}: a property named {@code id} would be mapped to
 * {@code _id}.
 */
public class StoredJob {

    private String jobId;
    private String tenantId;
    private String channelId;
    private String kind;
    private String subject;
    private long dueUnix;
    private long dueAtMs;
    private boolean repeatsDaily;
    private String createdBy;

    public StoredJob() {
    }

    static StoredJob from(Job job) {
        StoredJob stored = new StoredJob();
        stored.setJobId(job.id());
        stored.setTenantId(job.tenantId());
        stored.setChannelId(job.channelId());
        stored.setKind(job.kind());
        stored.setSubject(job.subject());
        stored.setDueUnix(job.dueUnix());
        stored.setDueAtMs(job.dueAtMs());
        stored.setRepeatsDaily(job.repeatsDaily());
        stored.setCreatedBy(job.createdBy());
        return stored;
    }

    Job toJob() {
        return new Job(jobId, tenantId, channelId, kind, subject, dueUnix, dueAtMs, repeatsDaily, createdBy);
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getChannelId() {
        return channelId;
    }

    public void setChannelId(String channelId) {
        this.channelId = channelId;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public long getDueUnix() {
        return dueUnix;
    }

    public void setDueUnix(long dueUnix) {
        this.dueUnix = dueUnix;
    }

    public long getDueAtMs() {
        return dueAtMs;
    }

    public void setDueAtMs(long dueAtMs) {
        this.dueAtMs = dueAtMs;
    }

    public boolean isRepeatsDaily() {
        return repeatsDaily;
    }

    public void setRepeatsDaily(boolean repeatsDaily) {
        this.repeatsDaily = repeatsDaily;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }
}
