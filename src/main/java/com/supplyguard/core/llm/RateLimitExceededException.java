package com.supplyguard.core.llm;

/**
 * No concurrency slot freed up within the maximum queue wait. Not retried.
 */
public class RateLimitExceededException extends AiUnavailableException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}
