package com.geons.resolver;

import com.geons.common.RandomSource;
import com.geons.domain.Policy;
import com.geons.domain.SliverTool;
import com.geons.lookup.CandidateProvider;

import java.util.List;

/**
 * Returns a random sliver tool located in the country the client asked for (exact, case-sensitive match).
 */
public class CountryResolver extends AbstractResolver {

    public CountryResolver(CandidateProvider candidateProvider, RandomSource randomSource) {
        super(candidateProvider, randomSource);
    }

    @Override
    public Policy policy() {
        return Policy.COUNTRY;
    }

    @Override
    protected Resolution select(LookupQuery query) {
        String country = query.getUserDefinedCountry();
        if (country == null || country.isEmpty()) {
            return Resolution.invalidQuery("country is required for the country policy");
        }
        List<SliverTool> inCountry = getCandidates(query).stream()
                .filter(t -> country.equals(t.getCountry()))
                .toList();
        if (inCountry.isEmpty()) {
            return notFound(query);
        }
        return pickOne(inCountry);
    }
}
