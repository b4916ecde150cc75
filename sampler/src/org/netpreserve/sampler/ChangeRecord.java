package org.netpreserve.sampler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * How often a URL's content changed within the sampled range.
 *
 * @param url          the URL that was counted
 * @param changeCount  digest transitions between adjacent captures across the whole range
 * @param periodCounts transitions between adjacent captures that fall within the same bucket, keyed by bucket label
 */
public record ChangeRecord(
        String url,
        @JsonProperty("change_count") int changeCount,
        @JsonProperty("change_counts") Map<String, Integer> periodCounts) {
}
