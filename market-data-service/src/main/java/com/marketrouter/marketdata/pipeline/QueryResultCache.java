package com.marketrouter.marketdata.pipeline;

import com.marketrouter.common.model.StandardResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of successful pipeline results keyed by query signature.
 *
 * <p>Entries expire {@code ttl} after they were stored; an expired entry found on lookup is
 * evicted and reported as a miss. Past {@code maxSize} the oldest entry is evicted on
 * insert. Entries are immutable, so a {@link ConcurrentHashMap} is all the locking needed.
 */
public class QueryResultCache {

    private static final Logger log = LoggerFactory.getLogger(QueryResultCache.class);

    private record Entry(StandardResult result, Instant storedAt) {}

    private final ConcurrentHashMap<String, Entry> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final int maxSize;
    private final Clock clock;

    public QueryResultCache(Duration ttl, int maxSize, Clock clock) {
        this.ttl     = ttl;
        this.maxSize = Math.max(1, maxSize);
        this.clock   = clock;
    }

    /** Returns the cached result, or {@code null} when absent or expired. */
    public StandardResult get(String signature) {
        Entry entry = store.get(signature);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry, clock.instant())) {
            store.remove(signature, entry);
            return null;
        }
        return entry.result();
    }

    public void put(String signature, StandardResult result) {
        store.put(signature, new Entry(result, clock.instant()));
        while (store.size() > maxSize) {
            store.entrySet().stream()
                .min(Comparator.comparing((Map.Entry<String, Entry> e) -> e.getValue().storedAt()))
                .ifPresent(oldest -> store.remove(oldest.getKey(), oldest.getValue()));
        }
    }

    /** Drops expired entries. Returns how many were removed. */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = store.size();
        store.values().removeIf(e -> isExpired(e, now));
        int removed = before - store.size();
        if (removed > 0) {
            log.debug("RESULT_CACHE_PURGED removed={} remaining={}", removed, store.size());
        }
        return removed;
    }

    public void clear() {
        store.clear();
    }

    public int size() {
        return store.size();
    }

    private boolean isExpired(Entry entry, Instant now) {
        return !now.isBefore(entry.storedAt().plus(ttl));
    }
}
