package com.supplyguard.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for conversation-thread scoped logging.
 */
public final class MdcContext {

    public static final String THREAD_ID = "threadId";
    public static final String AGENT = "agent";

    private MdcContext() {}

    public static void setThread(String threadId) {
        MDC.put(THREAD_ID, threadId);
    }

    public static void setAgent(String threadId, String agentName) {
        MDC.put(THREAD_ID, threadId);
        MDC.put(AGENT, agentName);
    }

    public static void clearAgent() {
        MDC.remove(AGENT);
    }

    public static void clear() {
        MDC.remove(THREAD_ID);
        MDC.remove(AGENT);
    }
}
