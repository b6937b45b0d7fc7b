package com.supplyguard.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Provider options and the timeout, retry and concurrency limits for AI calls.
 */
@Component
@ConfigurationProperties(prefix = "supplyguard.ai")
public class AiProperties {

    private boolean enabled = true;
    private String model = "openai/gpt-3.5-turbo";
    private double temperature = 0.7;
    private int maxTokens = 1000;
    private Duration timeout = Duration.ofSeconds(5);
    private int maxRetries = 2;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
    private int maxConcurrency = 4;
    private Duration maxQueueWait = Duration.ofSeconds(2);

    /**
     * Upper bound on how long one adapter call can take before it reports the
     * provider unavailable: every attempt timing out plus every backoff wait.
     */
    public Duration worstCaseLatency() {
        long total = timeout.toMillis() * (maxRetries + 1L);
        double wait = initialBackoff.toMillis();
        for (int i = 0; i < maxRetries; i++) {
            total += (long) wait;
            wait *= backoffMultiplier;
        }
        return Duration.ofMillis(total);
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }
    public int getMaxTokens() { return maxTokens; }
    public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
    public Duration getMaxQueueWait() { return maxQueueWait; }
    public void setMaxQueueWait(Duration maxQueueWait) { this.maxQueueWait = maxQueueWait; }
}
