package com.geons.resolver;

import com.geons.common.RandomSource;
import com.geons.domain.Policy;
import com.geons.domain.SliverTool;
import com.geons.lookup.CandidateProvider;

import java.util.List;

/**
 * Returns every candidate, in provider order.
 */
public class AllResolver extends AbstractResolver {

    public AllResolver(CandidateProvider candidateProvider, RandomSource randomSource) {
        super(candidateProvider, randomSource);
    }

    @Override
    public Policy policy() {
        return Policy.ALL;
    }

    @Override
    protected Resolution select(LookupQuery query) {
        List<SliverTool> candidates = getCandidates(query);
        if (candidates.isEmpty()) {
            return notFound(query);
        }
        return Resolution.found(candidates);
    }
}
