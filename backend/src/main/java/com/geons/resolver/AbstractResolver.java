package com.geons.resolver;

import com.geons.common.RandomSource;
import com.geons.domain.AddressFamily;
import com.geons.domain.SliverTool;
import com.geons.lookup.CandidateProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Shared candidate acquisition: fetch for the query's address family and, unless the client forced the family,
 * retry once with the other family.
 */
@Slf4j
public abstract class AbstractResolver implements Resolver {

    protected final CandidateProvider candidateProvider;
    protected final RandomSource randomSource;

    protected AbstractResolver(CandidateProvider candidateProvider, RandomSource randomSource) {
        this.candidateProvider = candidateProvider;
        this.randomSource = randomSource;
    }

    /**
     * Candidates for the query; empty when the family is unset or nothing is online in any permitted family.
     */
    public List<SliverTool> getCandidates(LookupQuery query) {
        AddressFamily family = query.getAddressFamily();
        if (family == null) {
            return List.of();
        }
        List<SliverTool> candidates = candidateProvider.fetch(query.getToolId(), family);
        if (candidates.isEmpty() && !query.isUserDefinedAddressFamily()) {
            log.info("No {} candidates for {}, trying {}", family, query.getToolId(), family.other());
            candidates = candidateProvider.fetch(query.getToolId(), family.other());
        }
        return candidates;
    }

    @Override
    public Resolution answerQuery(LookupQuery query) {
        if (query == null || query.getToolId() == null || query.getToolId().isBlank()) {
            return Resolution.invalidQuery("toolId is required");
        }
        return select(query);
    }

    /**
     * Policy-specific selection for a query with a toolId.
     */
    protected abstract Resolution select(LookupQuery query);

    protected Resolution notFound(LookupQuery query) {
        log.info("No results found for {}", query.getToolId());
        return Resolution.notFound();
    }

    protected Resolution pickOne(List<SliverTool> candidates) {
        return Resolution.single(randomSource.choose(candidates));
    }
}
