package com.geons.resolver;

/**
 * Outcome category of a resolution. Provider failures are exceptions, not outcomes.
 */
public enum ResolutionOutcome {
    FOUND,
    NOT_FOUND,
    INVALID_QUERY
}
