package com.supplyguard.core.classifier;

import com.supplyguard.core.SupplyGuardException;

/**
 * Classification broke in a way that leaves no safe agent to run. Fatal to the thread.
 */
public class ClassifierFailureException extends SupplyGuardException {

    public ClassifierFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
