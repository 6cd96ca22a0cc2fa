package io.doat4j.config;

import io.doat4j.internal.mongo.AlarmDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the DoAt module.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at startup unless
 * {@code doat.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations / ops scripts.
 *
 * <h3>Required indexes (collection: {@code tenant_alarms})</h3>
 * <ul>
 *   <li><b>idx_alarm_claim</b>: { alarmAt: 1, lockUntil: 1 }
 *       <br/>Used by polling upcoming alarms with lock filtering.</li>
 * </ul>
 *
 * <p>{@code tenant_schedules} is only ever read and written by {@code _id} and needs no extra index.
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.tenant_alarms.createIndex({ alarmAt: 1, lockUntil: 1 }, { name: "idx_alarm_claim" });
 * </pre>
 */
public class DoAtMongoIndexConfig {

    public static final String IDX_ALARM_CLAIM = "idx_alarm_claim";

    private final MongoTemplate mongoTemplate;

    public DoAtMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Manually ensure required indexes.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(AlarmDocument.class).ensureIndex(alarmClaimIndex());
    }

    /**
     * Keys: alarmAt ASC, lockUntil ASC
     */
    public static Index alarmClaimIndex() {
        return new Index()
                .on("alarmAt", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_ALARM_CLAIM);
    }
}
