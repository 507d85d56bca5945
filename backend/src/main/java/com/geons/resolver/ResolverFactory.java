package com.geons.resolver;

import com.geons.common.RandomSource;
import com.geons.domain.Policy;
import com.geons.lookup.CandidateProvider;
import com.geons.lookup.SiteLookup;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a policy to its resolver. Total: a missing or unrecognised policy gets the random resolver.
 * Resolvers are stateless, so one instance per policy is shared by all requests.
 */
@Slf4j
public class ResolverFactory {

    private final Map<Policy, Resolver> resolvers = new EnumMap<>(Policy.class);

    public ResolverFactory(CandidateProvider candidateProvider, SiteLookup siteLookup, RandomSource randomSource) {
        for (Policy policy : Policy.values()) {
            resolvers.put(policy, create(policy, candidateProvider, siteLookup, randomSource));
        }
    }

    private static Resolver create(Policy policy, CandidateProvider candidateProvider, SiteLookup siteLookup,
                                   RandomSource randomSource) {
        return switch (policy) {
            case GEO -> new GeoResolver(candidateProvider, randomSource);
            case GEO_OPTIONS -> new GeoOptionsResolver(candidateProvider, randomSource);
            case METRO -> new MetroResolver(candidateProvider, siteLookup, randomSource);
            case COUNTRY -> new CountryResolver(candidateProvider, randomSource);
            case RANDOM -> new RandomResolver(candidateProvider, randomSource);
            case ALL -> new AllResolver(candidateProvider, randomSource);
        };
    }

    public Resolver newResolver(Policy policy) {
        return resolvers.get(policy == null ? Policy.RANDOM : policy);
    }

    /**
     * Resolver for a request parameter value such as "geo_options"; unknown names get the random resolver.
     */
    public Resolver newResolver(String policyName) {
        return newResolver(Policy.fromString(policyName).orElse(Policy.RANDOM));
    }

    /**
     * Answers the query with the resolver for its policy.
     */
    public Resolution resolve(LookupQuery query) {
        Resolver resolver = newResolver(query == null ? null : query.getPolicy());
        Resolution resolution = resolver.answerQuery(query);
        log.debug("Policy {} answered {} with {}", resolver.policy(),
                query == null ? null : query.getToolId(), resolution.getOutcome());
        return resolution;
    }
}
