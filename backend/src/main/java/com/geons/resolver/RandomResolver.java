package com.geons.resolver;

import com.geons.common.RandomSource;
import com.geons.domain.Policy;
import com.geons.domain.SliverTool;
import com.geons.lookup.CandidateProvider;

import java.util.List;

/**
 * Returns one candidate chosen uniformly at random.
 */
public class RandomResolver extends AbstractResolver {

    public RandomResolver(CandidateProvider candidateProvider, RandomSource randomSource) {
        super(candidateProvider, randomSource);
    }

    @Override
    public Policy policy() {
        return Policy.RANDOM;
    }

    @Override
    protected Resolution select(LookupQuery query) {
        List<SliverTool> candidates = getCandidates(query);
        if (candidates.isEmpty()) {
            return notFound(query);
        }
        return pickOne(candidates);
    }
}
