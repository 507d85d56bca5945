package com.geons.lookup;

import com.geons.domain.SliverTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Periodically loads every sliver tool and puts each toolId's complete set into the cache.
 * Only writes entries; expiry is left to the cache TTL.
 */
@Component
@ConditionalOnProperty(prefix = "geons.lookup.cache-warm", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SliverToolCacheWarmer {

    private final SliverToolStore sliverToolStore;
    private final SliverToolCache sliverToolCache;

    @Scheduled(
            fixedDelayString = "${geons.lookup.cache-warm.interval-ms:60000}",
            initialDelayString = "${geons.lookup.cache-warm.interval-ms:60000}")
    public void runScheduled() {
        try {
            int tools = warm();
            log.info("Sliver tool cache warmed for {} tool ids", tools);
        } catch (CandidateProviderException e) {
            log.warn("Sliver tool cache warm failed, retrying next run: {}", e.getMessage());
        }
    }

    /**
     * @return number of tool ids written to the cache
     */
    public int warm() {
        Map<String, List<SliverTool>> byToolId = sliverToolStore.loadAll().stream()
                .filter(t -> t.getToolId() != null)
                .collect(Collectors.groupingBy(SliverTool::getToolId, LinkedHashMap::new, Collectors.toList()));
        byToolId.forEach(sliverToolCache::put);
        return byToolId.size();
    }
}
