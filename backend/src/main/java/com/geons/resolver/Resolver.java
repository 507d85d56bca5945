package com.geons.resolver;

import com.geons.domain.Policy;

/**
 * Selects sliver tools for a lookup according to one policy.
 */
public interface Resolver {

    Policy policy();

    /**
     * Answers the query. "Nothing matches" is {@link ResolutionOutcome#NOT_FOUND}, never an exception.
     *
     * @throws com.geons.lookup.CandidateProviderException if candidate data cannot be read
     */
    Resolution answerQuery(LookupQuery query);
}
