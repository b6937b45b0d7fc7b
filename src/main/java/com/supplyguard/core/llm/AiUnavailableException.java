package com.supplyguard.core.llm;

import com.supplyguard.core.SupplyGuardException;

/**
 * An AI call did not produce an answer in time: timeout, provider error, or
 * no concurrency slot. Never leaves {@link AiRiskAdapter}; it is turned into
 * {@link AiCallResult#unavailable(String)}.
 */
public class AiUnavailableException extends SupplyGuardException {

    public AiUnavailableException(String message) {
        super(message);
    }

    public AiUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
