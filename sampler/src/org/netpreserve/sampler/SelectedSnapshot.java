package org.netpreserve.sampler;

import java.time.LocalDate;

/**
 * The capture chosen to represent one sampling bucket.
 *
 * @param bucket label of the bucket, e.g. "2024-02" for a monthly bucket
 * @param ref    the chosen capture
 */
public record SelectedSnapshot(String bucket, SnapshotRef ref) {
    public String timestamp() {
        return ref.timestamp();
    }

    public LocalDate date() {
        return ref.date();
    }

    public String digest() {
        return ref.digest();
    }
}
