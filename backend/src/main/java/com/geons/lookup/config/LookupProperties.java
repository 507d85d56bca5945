package com.geons.lookup.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Candidate lookup configuration. Documented in application.yml under geons.lookup.
 */
@ConfigurationProperties(prefix = "geons.lookup")
@Validated
@Getter
@Setter
public class LookupProperties {

    /**
     * Upper bound on documents fetched by any single store query (sliver tools or sites).
     */
    @Min(1)
    private int maxFetchedResults = 1000;

    /**
     * Expire-after-write TTL for the per-tool sliver tool cache.
     */
    @Min(1)
    private long cacheTtlSeconds = 300;

    /**
     * Maximum number of tool ids held in the sliver tool cache.
     */
    @Min(1)
    private long cacheMaxSize = 10_000;

    @Valid
    private CacheWarmProperties cacheWarm = new CacheWarmProperties();

    @Getter
    @Setter
    public static class CacheWarmProperties {
        /** Periodically load every tool's full sliver tool set from the store into the cache. */
        private boolean enabled = false;
        /** Interval between warm runs in milliseconds. */
        @Min(1000)
        private long intervalMs = 60_000;
    }
}
