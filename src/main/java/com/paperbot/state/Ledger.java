package com.paperbot.state;

import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory delivery history. Insertion order of {@link #deliveredIds()} is delivery order.
 */
public final class Ledger {
    private final LinkedHashSet<String> deliveredIds = new LinkedHashSet<>();
    private final Map<String, Instant> lastSeenPublishedAt = new TreeMap<>();
    private Instant lastSuccessAt;

    public static Ledger empty() {
        return new Ledger();
    }

    public Set<String> deliveredIds() {
        return Collections.unmodifiableSet(deliveredIds);
    }

    public boolean isDelivered(String id) {
        return deliveredIds.contains(id);
    }

    public int size() {
        return deliveredIds.size();
    }

    public Instant lastSuccessAt() {
        return lastSuccessAt;
    }

    public Map<String, Instant> lastSeenPublishedAt() {
        return Collections.unmodifiableMap(lastSeenPublishedAt);
    }

    boolean addDelivered(String id) {
        return deliveredIds.add(id);
    }

    /**
     * Removes ids from the front until at most {@code maxSize} remain.
     *
     * @return number of evicted ids
     */
    int evictOldest(int maxSize) {
        int evicted = 0;
        Iterator<String> it = deliveredIds.iterator();
        while (deliveredIds.size() > maxSize && it.hasNext()) {
            it.next();
            it.remove();
            evicted++;
        }
        return evicted;
    }

    void setLastSuccessAt(Instant lastSuccessAt) {
        this.lastSuccessAt = lastSuccessAt;
    }

    void putLastSeen(String topic, Instant publishedAt) {
        lastSeenPublishedAt.put(topic, publishedAt);
    }
}
