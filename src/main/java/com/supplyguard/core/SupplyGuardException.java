package com.supplyguard.core;

/**
 * Root of the engine's unchecked exceptions.
 */
public class SupplyGuardException extends RuntimeException {

    public SupplyGuardException(String message) {
        super(message);
    }

    public SupplyGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
