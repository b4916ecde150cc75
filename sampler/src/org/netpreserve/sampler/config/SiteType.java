package org.netpreserve.sampler.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of resource being sampled for each input site.
 */
public enum SiteType {
    TOS, ROBOTS, MAIN;

    @JsonCreator
    public static SiteType fromString(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown site type: " + value + " (expected tos, robots or main)");
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
