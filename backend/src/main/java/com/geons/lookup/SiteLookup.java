package com.geons.lookup;

import com.geons.domain.Site;

import java.util.List;

/**
 * Site lookup by metro tag, used by the metro policy.
 */
public interface SiteLookup {

    /**
     * @return sites tagged with {@code metro}, empty when none
     * @throws CandidateProviderException if the store is unavailable
     */
    List<Site> fetchSitesByMetro(String metro);
}
