package com.supplyguard.core.llm;

import com.supplyguard.core.SupplyGuardException;

/**
 * The model returned no content at all.
 */
public class LlmEmptyResponseException extends SupplyGuardException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
