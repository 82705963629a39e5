package io.buddy4j.config;

import io.buddy4j.utils.IntervalParser;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration for the supervisor, its maintenance passes and the task store.
 */
public class BuddyProperties {
    private boolean enabled = true;
    private boolean autoStartup = true;
    private String defaultHandler = "general_chat";
    private int acquireAttempts = 5;
    private Duration acquireBackoff = Duration.ofSeconds(5);
    private Duration handlerTimeout; // null: no timeout
    private int workerThreads = 4;
    private int interactionLogSize = 50;
    private int historyContextSize = 10;
    private boolean sweepsEnabled = true;
    private Duration staleThreshold = Duration.ofDays(3);
    private String deadlineSweepEvery = "1 hour";
    private String staleSweepEvery = "6 hours";
    private String recurrenceSweepEvery = "15 minutes";
    private String prioritySweepEvery = "30 minutes";
    private String sweepTimezone; // null: system default
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private String store = "file";
    private String storagePath = "data/tasks.json";
    private boolean ensureIndexesOnStartup = false;

    /**
     * Checks counts, durations and schedule specs.
     *
     * @throws IllegalArgumentException on the first invalid value
     */
    public void validate() {
        requirePositive(acquireAttempts, "acquireAttempts");
        requirePositive(workerThreads, "workerThreads");
        requirePositive(interactionLogSize, "interactionLogSize");
        if (historyContextSize < 0) {
            throw new IllegalArgumentException("historyContextSize must be >= 0");
        }
        requireNonNegative(acquireBackoff, "acquireBackoff");
        requireNonNegative(shutdownTimeout, "shutdownTimeout");
        requireNonNegative(staleThreshold, "staleThreshold");
        if (handlerTimeout != null && (handlerTimeout.isZero() || handlerTimeout.isNegative())) {
            throw new IllegalArgumentException("handlerTimeout must be positive when set");
        }
        if (defaultHandler == null || defaultHandler.isBlank()) {
            throw new IllegalArgumentException("defaultHandler must not be blank");
        }
        IntervalParser.validate(deadlineSweepEvery);
        IntervalParser.validate(staleSweepEvery);
        IntervalParser.validate(recurrenceSweepEvery);
        IntervalParser.validate(prioritySweepEvery);
        sweepZone();
    }

    public ZoneId sweepZone() {
        return sweepTimezone == null || sweepTimezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(sweepTimezone);
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    private static void requireNonNegative(Duration value, String name) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a non-negative duration");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public String getDefaultHandler() {
        return defaultHandler;
    }

    public void setDefaultHandler(String defaultHandler) {
        this.defaultHandler = defaultHandler;
    }

    public int getAcquireAttempts() {
        return acquireAttempts;
    }

    public void setAcquireAttempts(int acquireAttempts) {
        this.acquireAttempts = acquireAttempts;
    }

    public Duration getAcquireBackoff() {
        return acquireBackoff;
    }

    public void setAcquireBackoff(Duration acquireBackoff) {
        this.acquireBackoff = acquireBackoff;
    }

    public Duration getHandlerTimeout() {
        return handlerTimeout;
    }

    public void setHandlerTimeout(Duration handlerTimeout) {
        this.handlerTimeout = handlerTimeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getInteractionLogSize() {
        return interactionLogSize;
    }

    public void setInteractionLogSize(int interactionLogSize) {
        this.interactionLogSize = interactionLogSize;
    }

    public int getHistoryContextSize() {
        return historyContextSize;
    }

    public void setHistoryContextSize(int historyContextSize) {
        this.historyContextSize = historyContextSize;
    }

    public boolean isSweepsEnabled() {
        return sweepsEnabled;
    }

    public void setSweepsEnabled(boolean sweepsEnabled) {
        this.sweepsEnabled = sweepsEnabled;
    }

    public Duration getStaleThreshold() {
        return staleThreshold;
    }

    public void setStaleThreshold(Duration staleThreshold) {
        this.staleThreshold = staleThreshold;
    }

    public String getDeadlineSweepEvery() {
        return deadlineSweepEvery;
    }

    public void setDeadlineSweepEvery(String deadlineSweepEvery) {
        this.deadlineSweepEvery = deadlineSweepEvery;
    }

    public String getStaleSweepEvery() {
        return staleSweepEvery;
    }

    public void setStaleSweepEvery(String staleSweepEvery) {
        this.staleSweepEvery = staleSweepEvery;
    }

    public String getRecurrenceSweepEvery() {
        return recurrenceSweepEvery;
    }

    public void setRecurrenceSweepEvery(String recurrenceSweepEvery) {
        this.recurrenceSweepEvery = recurrenceSweepEvery;
    }

    public String getPrioritySweepEvery() {
        return prioritySweepEvery;
    }

    public void setPrioritySweepEvery(String prioritySweepEvery) {
        this.prioritySweepEvery = prioritySweepEvery;
    }

    public String getSweepTimezone() {
        return sweepTimezone;
    }

    public void setSweepTimezone(String sweepTimezone) {
        this.sweepTimezone = sweepTimezone;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(String storagePath) {
        this.storagePath = storagePath;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
