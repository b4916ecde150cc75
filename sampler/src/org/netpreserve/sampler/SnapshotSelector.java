package org.netpreserve.sampler;

import org.netpreserve.sampler.config.Frequency;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeMap;

/**
 * Picks one capture per sampling bucket: the earliest capture within each calendar day, month or year.
 */
public class SnapshotSelector {

    private SnapshotSelector() {
    }

    /**
     * Returns the earliest capture of each bucket of {@code [startDate, endDate]} that has at least one capture,
     * ordered by time. Buckets without captures produce no entry. Captures outside the range are ignored.
     */
    public static List<SelectedSnapshot> select(Collection<SnapshotRef> refs, LocalDate startDate, LocalDate endDate,
                                                Frequency frequency) {
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate " + startDate + " is after endDate " + endDate);
        }
        var earliestByBucket = new TreeMap<LocalDate, SnapshotRef>();
        for (SnapshotRef ref : refs) {
            LocalDate date = ref.date();
            if (date.isBefore(startDate) || date.isAfter(endDate)) continue;
            earliestByBucket.merge(frequency.bucketStart(date), ref, (a, b) -> b.compareTo(a) < 0 ? b : a);
        }
        var selected = new ArrayList<SelectedSnapshot>(earliestByBucket.size());
        earliestByBucket.forEach((bucketStart, ref) ->
                selected.add(new SelectedSnapshot(frequency.label(bucketStart), ref)));
        return selected;
    }
}
