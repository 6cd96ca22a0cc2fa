package io.doat4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

/**
 * Mongo document holding the persisted scheduler values of one tenant.
 *
 * <p>{@code revision} is bumped on every job-set write and used as the compare-and-swap guard.
 */
@Document(collection = "tenant_schedules")
public class TenantStateDocument {

    @Id
    private String tenantId;

    private long revision;
    private List<StoredJob> jobs;
    private List<DeliveredEntry> delivered;

    public TenantStateDocument() {
    }

    /**
     * One dedup cache entry. Stored as a list: occurrence keys are not safe Mongo field names.
     */
    public static class DeliveredEntry {
        private String key;
        private long deliveredAtMs;

        public DeliveredEntry() {
        }

        public DeliveredEntry(String key, long deliveredAtMs) {
            this.key = key;
            this.deliveredAtMs = deliveredAtMs;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public long getDeliveredAtMs() {
            return deliveredAtMs;
        }

        public void setDeliveredAtMs(long deliveredAtMs) {
            this.deliveredAtMs = deliveredAtMs;
        }
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public long getRevision() {
        return revision;
    }

    public void setRevision(long revision) {
        this.revision = revision;
    }

    public List<StoredJob> getJobs() {
        return jobs;
    }

    public void setJobs(List<StoredJob> jobs) {
        this.jobs = jobs;
    }

    public List<DeliveredEntry> getDelivered() {
        return delivered;
    }

    public void setDelivered(List<DeliveredEntry> delivered) {
        this.delivered = delivered;
    }
}
