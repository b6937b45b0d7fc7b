package com.supplyguard.core.engine;

import com.supplyguard.core.SupplyGuardException;

/**
 * A query could not be answered at all: classification or storage failed,
 * so no partial result exists.
 */
public class PipelineFailedException extends SupplyGuardException {

    private final String threadId;

    public PipelineFailedException(String threadId, String message) {
        super(message);
        this.threadId = threadId;
    }

    public PipelineFailedException(String threadId, String message, Throwable cause) {
        super(message, cause);
        this.threadId = threadId;
    }

    public String getThreadId() {
        return threadId;
    }
}
