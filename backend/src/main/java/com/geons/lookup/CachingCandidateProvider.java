package com.geons.lookup;

import com.geons.domain.AddressFamily;
import com.geons.domain.SliverTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-through candidate lookup: filters a cached full tool set in memory, otherwise queries the store.
 * A failing cache is treated as a miss; a failing store is not.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CachingCandidateProvider implements CandidateProvider {

    private final SliverToolCache sliverToolCache;
    private final SliverToolStore sliverToolStore;

    @Override
    public List<SliverTool> fetch(String toolId, AddressFamily family, Set<String> siteAllowlist) {
        Optional<List<SliverTool>> cached = tryCache(toolId);
        if (cached.isPresent()) {
            log.info("Sliver tools found in cache for {} ({} results)", toolId, cached.get().size());
            return filter(cached.get(), family, siteAllowlist);
        }
        log.info("Sliver tools for {} not found in cache", toolId);
        return sliverToolStore.loadOnline(toolId, family, siteAllowlist);
    }

    private Optional<List<SliverTool>> tryCache(String toolId) {
        try {
            return sliverToolCache.get(toolId);
        } catch (RuntimeException e) {
            log.warn("Sliver tool cache read failed for {}, using store: {}", toolId, e.getMessage());
            return Optional.empty();
        }
    }

    static List<SliverTool> filter(List<SliverTool> sliverTools, AddressFamily family, Set<String> siteAllowlist) {
        return sliverTools.stream()
                .filter(family::isOnline)
                .filter(t -> siteAllowlist == null || siteAllowlist.contains(t.getSiteId()))
                .toList();
    }
}
