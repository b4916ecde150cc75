package org.netpreserve.sampler.config;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;

/**
 * Root configuration for a sampling run. Built once at startup and never modified while the run is in progress.
 *
 * @param siteType       what kind of resource each input URL refers to
 * @param frequency      size of the sampling buckets
 * @param startDate      first day of the range (inclusive)
 * @param endDate        last day of the range (inclusive)
 * @param workers        number of URLs processed concurrently, 0 to derive from the number of processors
 * @param countChanges   record how often each URL's content changed within the range
 * @param saveSnapshots  keep raw snapshot bodies in the snapshot cache and reuse them on re-runs
 * @param processToJson  write fetched content to the JSON dataset
 * @param archive        archive endpoints and request policy
 * @param output         output locations
 */
public record SamplerConfig(
        SiteType siteType,
        Frequency frequency,
        @JsonFormat(pattern = "yyyyMMdd")
        LocalDate startDate,
        @JsonFormat(pattern = "yyyyMMdd")
        LocalDate endDate,
        int workers,
        boolean countChanges,
        boolean saveSnapshots,
        boolean processToJson,
        ArchiveConfig archive,
        OutputConfig output
) {
    public SamplerConfig {
        if (siteType == null) throw new IllegalArgumentException("siteType is required");
        if (frequency == null) throw new IllegalArgumentException("frequency is required");
        if (startDate == null || endDate == null) throw new IllegalArgumentException("startDate and endDate are required");
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate " + startDate + " is after endDate " + endDate);
        }
        if (workers < 0) throw new IllegalArgumentException("workers must not be negative");
        if (archive == null) throw new IllegalArgumentException("archive is required");
        if (output == null) throw new IllegalArgumentException("output is required");
        if (!countChanges && !saveSnapshots) processToJson = true;
        if (workers == 0) workers = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    /**
     * Whether snapshot bodies need to be fetched at all.
     */
    @JsonIgnore
    public boolean fetchSnapshots() {
        return processToJson || saveSnapshots;
    }
}
