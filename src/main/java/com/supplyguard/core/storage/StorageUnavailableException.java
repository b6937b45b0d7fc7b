package com.supplyguard.core.storage;

import com.supplyguard.core.SupplyGuardException;

/**
 * The supply-chain store could not be read. Fatal to the conversation thread.
 */
public class StorageUnavailableException extends SupplyGuardException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
