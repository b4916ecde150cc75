package org.netpreserve.sampler;

import java.time.LocalDate;

/**
 * Text of one sampled capture, ready to be written to the dataset.
 */
public record SnapshotContent(String url, String domain, LocalDate date, String content) {
    public String dateString() {
        return date.toString();
    }
}
