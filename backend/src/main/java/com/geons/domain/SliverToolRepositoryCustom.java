package com.geons.domain;

import java.util.Collection;
import java.util.List;

/**
 * Custom sliver_tools queries using MongoTemplate (status field chosen per address family).
 */
public interface SliverToolRepositoryCustom {

    /**
     * Tools with the given toolId that are ONLINE for {@code family}, optionally restricted to
     * {@code siteIds} (null = any site). At most {@code limit} documents.
     */
    List<SliverTool> findOnline(String toolId, AddressFamily family, Collection<String> siteIds, int limit);
}
