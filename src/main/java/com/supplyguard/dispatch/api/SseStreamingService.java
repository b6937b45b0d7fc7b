package com.supplyguard.dispatch.api;

import com.supplyguard.core.events.EventBus;
import com.supplyguard.core.events.RiskEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Forwards {@link EventBus} events to {@link SseEmitter} clients.
 * <p>
 * An emitter follows either one conversation thread or every thread. Each
 * {@link RiskEvent} becomes one SSE frame named after its event type. The
 * emitter is unsubscribed from the bus when it completes, times out or fails.
 * A heartbeat comment keeps idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Emitter timeout: 10 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 10 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    /** Registration key for emitters that follow every thread. */
    static final String ALL_THREADS = "*";

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    /**
     * Emitter for the events of one conversation thread.
     */
    public SseEmitter createEmitter(String threadId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribe(threadId, event -> sendEvent(emitter, event));
        return register(threadId, emitter, subscription);
    }

    /**
     * Emitter for the events of every conversation thread.
     */
    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribeAll(event -> sendEvent(emitter, event));
        return register(ALL_THREADS, emitter, subscription);
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    /**
     * SSE frame payload for one event. Null agent is omitted.
     */
    static Map<String, Object> frameData(RiskEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("thread_id", event.threadId());
        if (event.agent() != null) {
            data.put("agent", event.agent());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private SseEmitter register(String key, SseEmitter emitter, EventBus.Subscription subscription) {
        var registration = new EmitterRegistration(key, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for {}", key);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for {}", key);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", key, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to confirm SSE connection for {}: {}", key, e.getMessage());
        }

        log.info("SSE emitter created for {} (timeout={}ms)", key, timeoutMs);
        return emitter;
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks remove the registration
                log.debug("Heartbeat failed for {} (connection likely closed): {}",
                        registration.key(), e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for {} (emitter not active)", registration.key());
            }
        }
    }

    private void sendEvent(SseEmitter emitter, RiskEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(frameData(event)));
        } catch (IOException e) {
            log.debug("Failed to send SSE event {} for thread {}: {}",
                    event.eventType(), event.threadId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription().unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for {}", registration.key());
    }

    private record EmitterRegistration(
            String key,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
