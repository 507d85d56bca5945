package com.geons.lookup;

import com.geons.domain.AddressFamily;
import com.geons.domain.SliverTool;

import java.util.List;
import java.util.Set;

/**
 * Two-tier (cache, then store) source of candidate sliver tools.
 */
public interface CandidateProvider {

    /**
     * Sliver tools for {@code toolId} that are ONLINE for {@code family}. When {@code siteAllowlist} is non-null
     * only tools at those sites qualify.
     *
     * @return matching tools, empty when nothing matches
     * @throws CandidateProviderException if the store is unavailable
     */
    List<SliverTool> fetch(String toolId, AddressFamily family, Set<String> siteAllowlist);

    default List<SliverTool> fetch(String toolId, AddressFamily family) {
        return fetch(toolId, family, null);
    }
}
