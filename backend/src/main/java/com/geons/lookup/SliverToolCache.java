package com.geons.lookup;

import com.github.benmanes.caffeine.cache.Cache;
import com.geons.domain.SliverTool;
import com.geons.lookup.config.LookupConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Per-toolId cache of the complete, unfiltered sliver tool set. Advisory: callers fall back to the store on a miss.
 */
@Component
public class SliverToolCache {

    private final Cache<String, List<SliverTool>> cache;

    public SliverToolCache(@Qualifier(LookupConfig.SLIVER_TOOL_CACHE) Cache<String, List<SliverTool>> cache) {
        this.cache = cache;
    }

    public Optional<List<SliverTool>> get(String toolId) {
        return Optional.ofNullable(cache.getIfPresent(toolId));
    }

    public void put(String toolId, List<SliverTool> sliverTools) {
        cache.put(toolId, List.copyOf(sliverTools));
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
