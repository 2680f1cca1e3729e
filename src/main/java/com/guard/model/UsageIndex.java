package com.guard.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lookup from endpoint to observed call count. An index built without a log file is empty
 * and answers zero for every endpoint.
 */
public final class UsageIndex {

    private static final UsageIndex EMPTY = new UsageIndex(Collections.emptyMap());

    private final Map<EndpointKey, Long> counts;

    private UsageIndex(Map<EndpointKey, Long> counts) {
        this.counts = counts;
    }

    public static UsageIndex empty() {
        return EMPTY;
    }

    /**
     * Builds an index from usage records. Records sharing a key are summed; a sum that would
     * overflow stays at {@link Long#MAX_VALUE}.
     */
    public static UsageIndex of(Collection<UsageRecord> records) {
        Map<EndpointKey, Long> counts = new TreeMap<>();
        for (UsageRecord record : records) {
            counts.merge(record.key(), record.count(), UsageIndex::saturatedSum);
        }
        return new UsageIndex(Collections.unmodifiableMap(counts));
    }

    private static long saturatedSum(long a, long b) {
        long sum = a + b;
        // Counts are non-negative, so a wrapped sum comes out negative
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    public long countFor(String path, String method) {
        return counts.getOrDefault(EndpointKey.of(path, method), 0L);
    }

    /**
     * @return {@code true} iff at least one call to this endpoint was recorded.
     */
    public boolean wasUsed(String path, String method) {
        return countFor(path, method) > 0;
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public int size() {
        return counts.size();
    }
}
