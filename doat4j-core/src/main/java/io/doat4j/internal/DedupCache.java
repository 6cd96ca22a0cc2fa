package io.doat4j.internal;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Occurrence keys that were already delivered, with their delivery time.
 *
 * <p>Best effort: absence of a key means "not known to be delivered". Entries older than the
 * retention window are dropped by {@link #prune(long)}.
 */
public class DedupCache {

    public static final Duration DEFAULT_RETENTION = Duration.ofDays(14);

    private final Map<String, Long> entries;
    private final long retentionMs;

    public DedupCache(Map<String, Long> entries, Duration retention) {
        Objects.requireNonNull(retention, "retention must not be null");
        if (retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be a positive duration");
        }
        this.entries = entries == null ? new LinkedHashMap<>() : new LinkedHashMap<>(entries);
        this.retentionMs = retention.toMillis();
    }

    public boolean isDelivered(String key) {
        return entries.containsKey(key);
    }

    public void markDelivered(String key, long atMs) {
        entries.put(key, atMs);
    }

    /**
     * Drop entries delivered before {@code nowMs - retention}, and any entry without a timestamp.
     */
    public void prune(long nowMs) {
        long cutoff = nowMs - retentionMs;
        Iterator<Map.Entry<String, Long>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Long at = it.next().getValue();
            if (at == null || at < cutoff) {
                it.remove();
            }
        }
    }

    public int size() {
        return entries.size();
    }

    public Map<String, Long> snapshot() {
        return new LinkedHashMap<>(entries);
    }
}
