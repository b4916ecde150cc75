package org.netpreserve.sampler;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Objects;

/**
 * One capture listed by the archive's index. Captures with equal digests are presumed to have identical content.
 *
 * @param timestamp 14 digit capture time as used by the archive (yyyyMMddHHmmss)
 * @param digest    content fingerprint reported by the index
 */
public record SnapshotRef(String timestamp, String digest) implements Comparable<SnapshotRef> {
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuuMMddHHmmss")
            .withResolverStyle(ResolverStyle.STRICT);

    public SnapshotRef {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(digest, "digest");
        if (!isValidTimestamp(timestamp)) throw new IllegalArgumentException("Invalid capture timestamp: " + timestamp);
    }

    public static boolean isValidTimestamp(String timestamp) {
        if (timestamp == null || timestamp.length() != 14) return false;
        try {
            LocalDateTime.parse(timestamp, TIMESTAMP_FORMAT);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    public LocalDateTime captureTime() {
        return LocalDateTime.parse(timestamp, TIMESTAMP_FORMAT);
    }

    public LocalDate date() {
        return captureTime().toLocalDate();
    }

    @Override
    public int compareTo(SnapshotRef o) {
        int cmp = timestamp.compareTo(o.timestamp);
        if (cmp != 0) return cmp;
        return digest.compareTo(o.digest);
    }
}
