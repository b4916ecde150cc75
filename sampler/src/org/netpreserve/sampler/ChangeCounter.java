package org.netpreserve.sampler;

import org.netpreserve.sampler.config.Frequency;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Measures how often content changed by comparing the digests of consecutive captures. No content is fetched.
 */
public class ChangeCounter {

    private ChangeCounter() {
    }

    /**
     * Counts the digest transitions between consecutive captures, ordered by timestamp.
     */
    public static int countChanges(Collection<SnapshotRef> refs) {
        List<SnapshotRef> sorted = sorted(refs);
        int changes = 0;
        for (int i = 1; i < sorted.size(); i++) {
            if (!sorted.get(i).digest().equals(sorted.get(i - 1).digest())) changes++;
        }
        return changes;
    }

    /**
     * Counts transitions over the whole sequence and, per bucket of {@code frequency}, the transitions between
     * consecutive captures that both fall in that bucket. Every bucket that has a capture gets an entry.
     */
    public static ChangeRecord countChanges(String url, Collection<SnapshotRef> refs, Frequency frequency) {
        List<SnapshotRef> sorted = sorted(refs);
        Map<String, Integer> periodCounts = new LinkedHashMap<>();
        int changes = 0;
        for (int i = 0; i < sorted.size(); i++) {
            SnapshotRef current = sorted.get(i);
            String bucket = frequency.label(frequency.bucketStart(current.date()));
            periodCounts.putIfAbsent(bucket, 0);
            if (i == 0) continue;
            SnapshotRef previous = sorted.get(i - 1);
            if (previous.digest().equals(current.digest())) continue;
            changes++;
            if (frequency.bucketStart(previous.date()).equals(frequency.bucketStart(current.date()))) {
                periodCounts.merge(bucket, 1, Integer::sum);
            }
        }
        return new ChangeRecord(url, changes, periodCounts);
    }

    private static List<SnapshotRef> sorted(Collection<SnapshotRef> refs) {
        var sorted = new ArrayList<>(refs);
        sorted.sort(null);
        return sorted;
    }
}
