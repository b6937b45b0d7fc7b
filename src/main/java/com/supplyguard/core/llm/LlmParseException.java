package com.supplyguard.core.llm;

import com.supplyguard.core.SupplyGuardException;

/**
 * The model answered, but not in the requested JSON shape.
 */
public class LlmParseException extends SupplyGuardException {

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
