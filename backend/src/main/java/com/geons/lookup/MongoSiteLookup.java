package com.geons.lookup;

import com.geons.domain.Site;
import com.geons.domain.SiteRepository;
import com.geons.lookup.config.LookupProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * SiteLookup over the sites collection, capped at {@code geons.lookup.max-fetched-results}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoSiteLookup implements SiteLookup {

    private final SiteRepository siteRepository;
    private final LookupProperties lookupProperties;

    @Override
    public List<Site> fetchSitesByMetro(String metro) {
        try {
            List<Site> sites = siteRepository.findByMetro(metro, PageRequest.of(0, lookupProperties.getMaxFetchedResults()));
            log.info("Found {} sites for metro {}", sites.size(), metro);
            return sites;
        } catch (DataAccessException e) {
            throw new CandidateProviderException("Site query failed for metro " + metro, e);
        }
    }
}
