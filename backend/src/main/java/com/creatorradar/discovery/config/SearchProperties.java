package com.creatorradar.discovery.config;

import com.creatorradar.domain.Platform;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Search worker limits and job deadlines.
 */
@ConfigurationProperties(prefix = "creatorradar.discovery.search")
@NoArgsConstructor
@Getter
@Setter
public class SearchProperties {

    /** Max creators taken from the provider for one keyword. */
    private int maxResultsPerKeyword = 50;

    /** Max provider pages (continuation runs) fetched for one keyword. */
    private int maxContinuationRuns = 5;

    /**
     * Keywords dispatched in parallel at job creation. Each search worker chains keyword batchIndex + fanOut,
     * so 1 means strictly sequential.
     */
    private int keywordFanOut = 1;

    /** Upper bound on keywords per job, after expansion. */
    private int maxKeywords = 50;

    /** Expected unique creators per keyword; drives how many keywords expansion asks for. */
    private int creatorsPerKeyword = 45;

    /** Max targetResults accepted at job creation. */
    private int maxTargetResults = 1_000;

    /** Job deadline per platform, measured from creation. */
    private Map<Platform, Duration> jobTimeout = defaultTimeouts();

    /** Deadline used for a platform that has no entry in {@link #jobTimeout}. */
    private Duration defaultJobTimeout = Duration.ofMinutes(10);

    public Duration timeoutFor(Platform platform) {
        Duration d = jobTimeout != null ? jobTimeout.get(platform) : null;
        return d != null ? d : defaultJobTimeout;
    }

    private static Map<Platform, Duration> defaultTimeouts() {
        Map<Platform, Duration> m = new EnumMap<>(Platform.class);
        m.put(Platform.TIKTOK, Duration.ofMinutes(10));
        m.put(Platform.INSTAGRAM, Duration.ofMinutes(15));
        m.put(Platform.YOUTUBE, Duration.ofMinutes(10));
        return m;
    }
}
