package io.doat4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.doat4j.AlarmClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;

/**
 * MongoDB-backed timer facility: one {@link AlarmDocument} per tenant.
 *
 * <p>Setting or deleting the alarm never touches the claim lock, so a wake that is running while
 * the alarm moves keeps its claim. The document also stores the job-set revision of the last
 * applied write, which is how stale writes are recognized. A wake is claimed atomically with {@code findAndModify}
 * (read + update), which makes at most one worker run a tenant's wake at a time.
 */
public class MongoAlarmClock implements AlarmClock {
    private static final Logger log = LoggerFactory.getLogger(MongoAlarmClock.class);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    private final List<BiConsumer<String, Instant>> listeners = new CopyOnWriteArrayList<>();

    public MongoAlarmClock(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Register a callback invoked after every {@link #setAlarm(String, Instant, long)} that is applied in this process.
     */
    public void addListener(BiConsumer<String, Instant> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public boolean setAlarm(String tenantId, Instant at, long revision) {
        Objects.requireNonNull(at, "at must not be null");
        boolean applied = applyIfCurrent(tenantId, revision, new Update().set("alarmAt", at));
        if (applied) {
            notifyListeners(tenantId, at);
        }
        return applied;
    }

    @Override
    public boolean deleteAlarm(String tenantId, long revision) {
        return applyIfCurrent(tenantId, revision, new Update().unset("alarmAt"));
    }

    // Writes only when no newer job-set revision has been applied; creates the document if absent.
    private boolean applyIfCurrent(String tenantId, long revision, Update update) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        update.set("jobSetRevision", revision);
        Query guard = new Query(
                Criteria.where("_id").is(tenantId)
                        .orOperator(
                                Criteria.where("jobSetRevision").exists(false),
                                Criteria.where("jobSetRevision").lte(revision)
                        )
        );

        try {
            UpdateResult r = mongoTemplate.upsert(guard, update, AlarmDocument.class);
            if (r.getMatchedCount() > 0 || r.getUpsertedId() != null) {
                return true;
            }
        } catch (DuplicateKeyException e) {
            // The document exists but holds a newer revision, or a concurrent insert won; re-check.
            UpdateResult r = mongoTemplate.updateFirst(guard, update, AlarmDocument.class);
            if (r.getMatchedCount() > 0) {
                return true;
            }
        }
        log.debug("doat stale alarm write ignored tenant={} revision={}", tenantId, revision);
        return false;
    }

    @Override
    public Optional<Instant> getAlarm(String tenantId) {
        AlarmDocument doc = mongoTemplate.findById(tenantId, AlarmDocument.class);
        return Optional.ofNullable(doc == null ? null : doc.getAlarmAt());
    }

    public AlarmDocument find(String tenantId) {
        return mongoTemplate.findById(tenantId, AlarmDocument.class);
    }

    /**
     * Unclaimed alarms due at or before {@code windowEnd}, earliest first. Nothing is locked.
     */
    public List<AlarmDocument> findUpcoming(Instant windowEnd, int limit) {
        Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        if (limit <= 0) {
            return List.of();
        }

        Query q = new Query(
                Criteria.where("alarmAt").ne(null).lte(windowEnd)
                        .andOperator(unlocked(clock.instant()))
        );
        q.with(Sort.by(Sort.Order.asc("alarmAt")));
        q.limit(limit);
        q.fields().include("_id").include("alarmAt");
        return mongoTemplate.find(q, AlarmDocument.class);
    }

    /**
     * Atomically claims the tenant's alarm if it is due and not held by another worker.
     *
     * @return the claimed document (with the claimed {@code alarmAt}), or null when not claimable
     */
    public AlarmDocument claim(String tenantId, Duration lockLifetime, String workerId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Instant now = clock.instant();
        Query q = new Query(
                Criteria.where("_id").is(tenantId)
                        .and("alarmAt").ne(null).lte(now)
                        .andOperator(unlocked(now))
        );
        Update lock = new Update()
                .set("lockedAt", now)
                .set("lockUntil", now.plus(lockLifetime))
                .set("lockedBy", workerId);

        return mongoTemplate.findAndModify(q, lock, FindAndModifyOptions.options().returnNew(true), AlarmDocument.class);
    }

    /**
     * Claims the tenant for a wake requested outside the schedule. Unlike
     * {@link #claim(String, Duration, String)} the alarm does not have to be due, or exist.
     *
     * @return the claimed document, or null when another worker holds the claim
     */
    public AlarmDocument claimAny(String tenantId, Duration lockLifetime, String workerId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Instant now = clock.instant();
        Query q = new Query(Criteria.where("_id").is(tenantId).andOperator(unlocked(now)));
        Update lock = new Update()
                .set("lockedAt", now)
                .set("lockUntil", now.plus(lockLifetime))
                .set("lockedBy", workerId);

        try {
            return mongoTemplate.findAndModify(q, lock,
                    FindAndModifyOptions.options().returnNew(true).upsert(true), AlarmDocument.class);
        } catch (DuplicateKeyException e) {
            // exists and is locked
            return null;
        }
    }

    /**
     * Finish a successful wake: consume the claimed alarm unless the wake moved it, then release
     * the claim.
     */
    public UpdateResult markSuccess(String tenantId, String workerId, Instant claimedAlarmAt, Instant finishedAt) {
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");

        if (claimedAlarmAt != null) {
            mongoTemplate.updateFirst(
                    new Query(Criteria.where("_id").is(tenantId)
                            .and("lockedBy").is(workerId)
                            .and("alarmAt").is(claimedAlarmAt)),
                    new Update().unset("alarmAt"),
                    AlarmDocument.class
            );
        }

        Update u = releaseLock()
                .set("lastWokeAt", finishedAt)
                .unset("failedAt")
                .set("failCount", 0);
        return mongoTemplate.updateFirst(ownedBy(tenantId, workerId), u, AlarmDocument.class);
    }

    /**
     * Finish a failed wake: count the failure, re-arm the alarm at {@code retryAt} and release the
     * claim. An alarm that is still in the future and earlier than {@code retryAt} is kept.
     */
    public UpdateResult markFailure(String tenantId, String workerId, Instant failedAt, Instant retryAt) {
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(failedAt, "failedAt must not be null");
        Objects.requireNonNull(retryAt, "retryAt must not be null");

        Instant next = retryAt;
        AlarmDocument current = find(tenantId);
        if (current != null && current.getAlarmAt() != null
                && current.getAlarmAt().isAfter(failedAt)
                && current.getAlarmAt().isBefore(retryAt)) {
            next = current.getAlarmAt();
        }

        Update u = releaseLock()
                .inc("failCount", 1)
                .set("failedAt", failedAt)
                .set("alarmAt", next);
        UpdateResult r = mongoTemplate.updateFirst(ownedBy(tenantId, workerId), u, AlarmDocument.class);
        if (r.getModifiedCount() == 0) {
            log.warn("doat alarm failure not recorded, claim lost tenant={} workerId={}", tenantId, workerId);
        } else {
            notifyListeners(tenantId, next);
        }
        return r;
    }

    private void notifyListeners(String tenantId, Instant at) {
        for (BiConsumer<String, Instant> listener : listeners) {
            listener.accept(tenantId, at);
        }
    }

    private static Query byTenant(String tenantId) {
        return new Query(Criteria.where("_id").is(tenantId));
    }

    private static Query ownedBy(String tenantId, String workerId) {
        return new Query(Criteria.where("_id").is(tenantId).and("lockedBy").is(workerId));
    }

    private static Criteria unlocked(Instant now) {
        return new Criteria().orOperator(
                Criteria.where("lockUntil").is(null),
                Criteria.where("lockUntil").lte(now)
        );
    }

    private static Update releaseLock() {
        return new Update()
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");
    }
}
