package com.geons.lookup;

import com.geons.domain.AddressFamily;
import com.geons.domain.SliverTool;
import com.geons.domain.SliverToolRepository;
import com.geons.lookup.config.LookupProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Store side of the candidate lookup: Mongo queries with the status and site predicates pushed down,
 * capped at {@code geons.lookup.max-fetched-results}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SliverToolStore {

    private final SliverToolRepository sliverToolRepository;
    private final LookupProperties lookupProperties;

    /**
     * @throws CandidateProviderException when the query fails
     */
    public List<SliverTool> loadOnline(String toolId, AddressFamily family, Set<String> siteAllowlist) {
        try {
            List<SliverTool> found = sliverToolRepository.findOnline(
                    toolId, family, siteAllowlist, lookupProperties.getMaxFetchedResults());
            log.info("Found {} candidates in store for {} ({})", found.size(), toolId, family);
            return found;
        } catch (DataAccessException e) {
            throw new CandidateProviderException("Sliver tool query failed for " + toolId, e);
        }
    }

    /**
     * All sliver tools, used to populate the cache. Read in pages of {@code max-fetched-results} ordered by id.
     *
     * @throws CandidateProviderException when a page query fails
     */
    public List<SliverTool> loadAll() {
        int pageSize = lookupProperties.getMaxFetchedResults();
        List<SliverTool> all = new ArrayList<>();
        try {
            Pageable pageable = PageRequest.of(0, pageSize, Sort.by("id"));
            Page<SliverTool> page;
            do {
                page = sliverToolRepository.findAll(pageable);
                all.addAll(page.getContent());
                pageable = page.nextPageable();
            } while (page.hasNext());
        } catch (DataAccessException e) {
            throw new CandidateProviderException("Sliver tool scan failed", e);
        }
        log.debug("Loaded {} sliver tools in pages of {}", all.size(), pageSize);
        return all;
    }
}
