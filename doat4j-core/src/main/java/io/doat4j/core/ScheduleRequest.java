package io.doat4j.core;

import java.util.Objects;

/**
 * A schedule command as produced by the command layer.
 *
 * <p>This is an API-layer object: the scheduler still checks the kind, the subject and the due
 * time before anything is persisted.
 *
 * @param timestamp due time as Unix seconds; values above {@link #MILLIS_THRESHOLD} are taken as
 *                  milliseconds
 */
public record ScheduleRequest(
        String tenantId,
        String channelId,
        String kind,
        String subject,
        long timestamp,
        boolean repeatsDaily,
        String createdBy
) {

    public static final long MILLIS_THRESHOLD = 10_000_000_000L;

    public ScheduleRequest {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(channelId, "channelId must not be null");
        subject = subject == null ? "" : subject;
    }

    /**
     * Due time in whole Unix seconds.
     */
    public long dueUnix() {
        return timestamp > MILLIS_THRESHOLD ? Math.floorDiv(timestamp, 1000L) : timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String tenantId;
        private String channelId;
        private String kind;
        private String subject;
        private long timestamp;
        private boolean repeatsDaily;
        private String createdBy;

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder channelId(String channelId) {
            this.channelId = channelId;
            return this;
        }

        public Builder kind(JobKind kind) {
            this.kind = kind.key();
            return this;
        }

        /**
         * Raw dispatch key, for callers that forward an unchecked value.
         */
        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder repeatsDaily(boolean repeatsDaily) {
            this.repeatsDaily = repeatsDaily;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public ScheduleRequest build() {
            if (tenantId == null || tenantId.isBlank()) {
                throw new IllegalStateException("ScheduleRequest must contain a tenantId");
            }
            if (channelId == null || channelId.isBlank()) {
                throw new IllegalStateException("ScheduleRequest must contain a channelId");
            }
            return new ScheduleRequest(tenantId, channelId, kind, subject, timestamp, repeatsDaily, createdBy);
        }
    }
}
