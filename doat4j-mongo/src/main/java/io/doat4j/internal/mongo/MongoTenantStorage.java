package io.doat4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.doat4j.TenantStorage;
import io.doat4j.core.Job;
import io.doat4j.core.JobSet;
import io.doat4j.core.JobSetMutation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB persistence of the per-tenant job set and dedup cache.
 *
 * <p>One {@link TenantStateDocument} per tenant. Job-set updates are an optimistic
 * compare-and-swap loop on {@code revision}:
 * <ul>
 *   <li>read jobs + revision</li>
 *   <li>apply the mutation to a copy</li>
 *   <li>write back only if the revision is unchanged (upsert for a new tenant); otherwise retry</li>
 * </ul>
 */
public class MongoTenantStorage implements TenantStorage {
    private static final Logger log = LoggerFactory.getLogger(MongoTenantStorage.class);

    static final int CAS_MAX = 16;

    private final MongoTemplate mongoTemplate;

    public MongoTenantStorage(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public JobSet loadJobSet(String tenantId) {
        TenantStateDocument doc = findState(tenantId, "jobs");
        return new JobSet(toJobs(doc), doc == null ? 0L : doc.getRevision());
    }

    @Override
    public <R> R updateJobs(String tenantId, JobSetMutation<R> mutation) {
        Objects.requireNonNull(mutation, "mutation must not be null");

        for (int attempt = 0; attempt < CAS_MAX; attempt++) {
            TenantStateDocument doc = findState(tenantId, "jobs");
            long revision = doc == null ? 0L : doc.getRevision();

            List<Job> current = toJobs(doc);
            List<Job> working = new ArrayList<>(current);
            R result = mutation.apply(working);
            if (working.equals(current)) {
                return result;
            }

            List<StoredJob> stored = new ArrayList<>(working.size());
            for (Job job : working) {
                stored.add(StoredJob.from(job));
            }

            // Upsert: a tenant without a document is written at revision 0 -> 1.
            Query guard = new Query(Criteria.where("_id").is(tenantId).and("revision").is(revision));
            Update update = new Update()
                    .set("jobs", stored)
                    .set("revision", revision + 1);

            try {
                UpdateResult r = mongoTemplate.upsert(guard, update, TenantStateDocument.class);
                if (r.getMatchedCount() > 0 || r.getUpsertedId() != null) {
                    return result;
                }
            } catch (DuplicateKeyException e) {
                // Another writer created the tenant document first.
                log.debug("doat job set insert raced tenant={} attempt={}", tenantId, attempt);
                continue;
            }
            log.debug("doat job set revision conflict tenant={} revision={} attempt={}", tenantId, revision, attempt);
        }

        throw new IllegalStateException("Unable to update jobs of tenant " + tenantId + " after CAS retries");
    }

    @Override
    public Map<String, Long> loadDelivered(String tenantId) {
        TenantStateDocument doc = findState(tenantId, "delivered");
        Map<String, Long> delivered = new LinkedHashMap<>();
        if (doc == null || doc.getDelivered() == null) {
            return delivered;
        }
        for (TenantStateDocument.DeliveredEntry e : doc.getDelivered()) {
            if (e != null && e.getKey() != null) {
                delivered.put(e.getKey(), e.getDeliveredAtMs());
            }
        }
        return delivered;
    }

    @Override
    public void saveDelivered(String tenantId, Map<String, Long> delivered) {
        Objects.requireNonNull(delivered, "delivered must not be null");

        List<TenantStateDocument.DeliveredEntry> entries = new ArrayList<>(delivered.size());
        for (var e : delivered.entrySet()) {
            if (e.getValue() != null) {
                entries.add(new TenantStateDocument.DeliveredEntry(e.getKey(), e.getValue()));
            }
        }

        Update u = new Update()
                .set("delivered", entries)
                .setOnInsert("revision", 0L);
        mongoTemplate.upsert(new Query(Criteria.where("_id").is(requireTenant(tenantId))), u, TenantStateDocument.class);
    }

    private TenantStateDocument findState(String tenantId, String field) {
        Query q = new Query(Criteria.where("_id").is(requireTenant(tenantId)));
        q.fields().include(field).include("revision");
        return mongoTemplate.findOne(q, TenantStateDocument.class);
    }

    private static List<Job> toJobs(TenantStateDocument doc) {
        if (doc == null || doc.getJobs() == null) {
            return List.of();
        }
        List<Job> jobs = new ArrayList<>(doc.getJobs().size());
        for (StoredJob stored : doc.getJobs()) {
            if (stored != null) {
                jobs.add(stored.toJob());
            }
        }
        return jobs;
    }

    private static String requireTenant(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        return tenantId;
    }
}
