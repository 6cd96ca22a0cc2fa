package io.doat4j.internal;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DedupCacheTest {

    private static final long NOW = 1_800_000_000_000L;
    private static final long DAY = Duration.ofDays(1).toMillis();

    @Test
    void pruneDropsEntriesOlderThanRetention() {
        Map<String, Long> stored = new HashMap<>();
        stored.put("a:1", NOW - 15 * DAY);
        stored.put("b:1", NOW - 14 * DAY);
        stored.put("c:1", NOW - DAY);
        stored.put("d:1", null);
        DedupCache cache = new DedupCache(stored, DedupCache.DEFAULT_RETENTION);

        cache.prune(NOW);

        assertFalse(cache.isDelivered("a:1"));
        assertTrue(cache.isDelivered("b:1"));
        assertTrue(cache.isDelivered("c:1"));
        assertFalse(cache.isDelivered("d:1"));
        assertEquals(2, cache.size());
    }

    @Test
    void markedKeysAreDeliveredAndSnapshotIsDetached() {
        DedupCache cache = new DedupCache(null, Duration.ofHours(1));

        cache.markDelivered("job:100", NOW);
        Map<String, Long> snapshot = cache.snapshot();
        cache.markDelivered("job:200", NOW);

        assertTrue(cache.isDelivered("job:100"));
        assertFalse(cache.isDelivered("job:300"));
        assertEquals(Map.of("job:100", NOW), snapshot);
    }

    @Test
    void retentionMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new DedupCache(Map.of(), Duration.ZERO));
    }
}
