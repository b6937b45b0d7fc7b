package com.supplyguard.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Emitted while a conversation thread runs.
 *
 * @param eventType e.g. "thread.started", "agent.finished", "thread.failed"
 * @param threadId  the conversation thread the event belongs to
 * @param agent     agent name for agent-level events, null for thread-level ones
 * @param payload   event-specific data
 * @param timestamp when the event occurred
 */
public record RiskEvent(
    String eventType,
    String threadId,
    String agent,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
