package org.netpreserve.sampler.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Sampling frequency. Each frequency partitions time into calendar buckets of one day, month or year.
 */
public enum Frequency {
    DAILY("yyyy-MM-dd"),
    MONTHLY("yyyy-MM"),
    ANNUALLY("yyyy");

    private final DateTimeFormatter labelFormat;

    Frequency(String labelPattern) {
        this.labelFormat = DateTimeFormatter.ofPattern(labelPattern, Locale.ROOT);
    }

    @JsonCreator
    public static Frequency fromString(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown frequency: " + value + " (expected daily, monthly or annually)");
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * First day of the bucket containing the given date.
     */
    public LocalDate bucketStart(LocalDate date) {
        return switch (this) {
            case DAILY -> date;
            case MONTHLY -> date.withDayOfMonth(1);
            case ANNUALLY -> date.withDayOfYear(1);
        };
    }

    public String label(LocalDate date) {
        return labelFormat.format(date);
    }
}
