package com.geons.lookup;

/**
 * Thrown when the backing store cannot be queried or returns something unusable.
 * Never used for "no match"; an empty list means that.
 */
public class CandidateProviderException extends RuntimeException {

    public CandidateProviderException(String message) {
        super(message);
    }

    public CandidateProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
