package com.creatorradar.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Social platform a discovery job searches.
 */
public enum Platform {
    TIKTOK("TikTok"),
    INSTAGRAM("Instagram"),
    YOUTUBE("YouTube");

    private final String displayName;

    Platform(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** Lowercase wire form used in queue messages, provider paths and identity keys. */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup; empty for null, blank or unknown values.
     */
    public static Optional<Platform> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Platform p : values()) {
            if (p.name().equals(normalized)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Platform fromJson(String value) {
        return fromWire(value).orElseThrow(() -> new IllegalArgumentException("Unsupported platform: " + value));
    }
}
