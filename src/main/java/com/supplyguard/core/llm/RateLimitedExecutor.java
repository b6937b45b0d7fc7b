package com.supplyguard.core.llm;

import com.supplyguard.core.metrics.SupplyGuardMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide cap on concurrent AI calls.
 *
 * <p>Callers wait at most {@code maxQueueWait} for one of {@code maxConcurrency}
 * fair permits. The call itself runs on a worker thread and is abandoned
 * (cancelled) when it exceeds its timeout or the caller is interrupted; the
 * permit is released at that moment rather than when the worker finishes.
 */
@Component
public class RateLimitedExecutor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitedExecutor.class);

    private final Semaphore permits;
    private final int maxConcurrency;
    private final Duration maxQueueWait;
    private final ExecutorService workers;
    private final SupplyGuardMetrics metrics;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    @Autowired
    public RateLimitedExecutor(AiProperties properties, SupplyGuardMetrics metrics) {
        this(properties.getMaxConcurrency(), properties.getMaxQueueWait(), metrics);
    }

    public RateLimitedExecutor(int maxConcurrency, Duration maxQueueWait, SupplyGuardMetrics metrics) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        this.permits = new Semaphore(maxConcurrency, true);
        this.maxQueueWait = maxQueueWait;
        this.workers = Executors.newCachedThreadPool(workerThreads());
        this.metrics = metrics;
        if (metrics != null) {
            metrics.registerInFlightGauge(inFlight::get);
        }
    }

    /**
     * Runs {@code task} once a slot is free, bounded by {@code timeout}.
     *
     * @throws RateLimitExceededException when no slot frees up within the queue wait
     * @throws AiUnavailableException     when the task times out, fails, or the caller is interrupted
     */
    public <T> T call(Callable<T> task, Duration timeout) {
        try {
            if (!permits.tryAcquire(maxQueueWait.toMillis(), TimeUnit.MILLISECONDS)) {
                if (metrics != null) {
                    metrics.recordRateLimitRejection();
                }
                throw new RateLimitExceededException("No AI slot available within " + maxQueueWait.toMillis() + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AiUnavailableException("Interrupted while waiting for an AI slot", e);
        }

        int current = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(current, Math::max);
        Future<T> future = null;
        try {
            future = workers.submit(task);
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AiUnavailableException("AI call timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AiUnavailableException("AI call abandoned: caller interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AiUnavailableException("AI provider error: " + cause.getMessage(), cause);
        } finally {
            inFlight.decrementAndGet();
            permits.release();
        }
    }

    public int inFlight() {
        return inFlight.get();
    }

    /** Highest concurrent in-flight count observed since start-up. */
    public int peakInFlight() {
        return peakInFlight.get();
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
        log.debug("AI worker pool shut down");
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            var t = new Thread(r, "ai-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
