package io.doat4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for the single wake time of a tenant and its claim lock.
 */
@Document(collection = "tenant_alarms")
public class AlarmDocument {

    @Id
    private String tenantId;

    private Instant alarmAt;
    private long jobSetRevision; // revision of the job set alarmAt was computed from

    private Instant lockedAt;
    private Instant lockUntil;
    private String lockedBy;
    private Instant lastWokeAt;

    private int failCount;
    private Instant failedAt;

    public AlarmDocument() {
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public Instant getAlarmAt() {
        return alarmAt;
    }

    public void setAlarmAt(Instant alarmAt) {
        this.alarmAt = alarmAt;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(Instant lockedAt) {
        this.lockedAt = lockedAt;
    }

    public Instant getLockUntil() {
        return lockUntil;
    }

    public void setLockUntil(Instant lockUntil) {
        this.lockUntil = lockUntil;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    public Instant getLastWokeAt() {
        return lastWokeAt;
    }

    public void setLastWokeAt(Instant lastWokeAt) {
        this.lastWokeAt = lastWokeAt;
    }

    public long getJobSetRevision() {
        return jobSetRevision;
    }

    public void setJobSetRevision(long jobSetRevision) {
        this.jobSetRevision = jobSetRevision;
    }

    public int getFailCount() {
        return failCount;
    }

    public void setFailCount(int failCount) {
        this.failCount = failCount;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(Instant failedAt) {
        this.failedAt = failedAt;
    }
}
