package com.geons.resolver;

import com.geons.common.RandomSource;
import com.geons.domain.Policy;
import com.geons.domain.Site;
import com.geons.domain.SliverTool;
import com.geons.lookup.CandidateProvider;
import com.geons.lookup.SiteLookup;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Returns a random sliver tool at one of the sites tagged with the requested metro.
 * The site restriction is pushed into the lookup and the requested address family is never swapped.
 */
@Slf4j
public class MetroResolver extends AbstractResolver {

    private final SiteLookup siteLookup;

    public MetroResolver(CandidateProvider candidateProvider, SiteLookup siteLookup, RandomSource randomSource) {
        super(candidateProvider, randomSource);
        this.siteLookup = siteLookup;
    }

    @Override
    public Policy policy() {
        return Policy.METRO;
    }

    @Override
    public List<SliverTool> getCandidates(LookupQuery query) {
        if (query.getAddressFamily() == null) {
            return List.of();
        }
        List<Site> sites = siteLookup.fetchSitesByMetro(query.getMetro());
        if (sites.isEmpty()) {
            log.info("No sites found for metro {}", query.getMetro());
            return List.of();
        }
        Set<String> siteIds = sites.stream()
                .map(Site::getSiteId)
                .collect(Collectors.toSet());
        return candidateProvider.fetch(query.getToolId(), query.getAddressFamily(), siteIds);
    }

    @Override
    protected Resolution select(LookupQuery query) {
        if (query.getMetro() == null || query.getMetro().isBlank()) {
            return Resolution.invalidQuery("metro is required for the metro policy");
        }
        List<SliverTool> candidates = getCandidates(query);
        if (candidates.isEmpty()) {
            return notFound(query);
        }
        return pickOne(candidates);
    }
}
