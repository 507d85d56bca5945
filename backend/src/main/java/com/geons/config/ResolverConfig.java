package com.geons.config;

import com.geons.common.RandomSource;
import com.geons.common.ThreadLocalRandomSource;
import com.geons.lookup.CandidateProvider;
import com.geons.lookup.SiteLookup;
import com.geons.resolver.ResolverFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the resolver factory to the candidate lookup and a shared, contention-free random source.
 */
@Configuration
public class ResolverConfig {

    @Bean
    public RandomSource randomSource() {
        return new ThreadLocalRandomSource();
    }

    @Bean
    public ResolverFactory resolverFactory(CandidateProvider candidateProvider, SiteLookup siteLookup,
                                           RandomSource randomSource) {
        return new ResolverFactory(candidateProvider, siteLookup, randomSource);
    }
}
