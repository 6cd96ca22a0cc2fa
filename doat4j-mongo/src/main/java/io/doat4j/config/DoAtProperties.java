package io.doat4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the scheduler and its wake runner.
 */
@ConfigurationProperties(prefix = "doat")
public class DoAtProperties {
    private int maxConcurrency = 20; // concurrent tenant wakes
    private int batchSize = 50; // alarms fetched per poll
    private Duration lockLifetime = Duration.ofMinutes(10);
    private Duration processEvery = Duration.ofSeconds(5);
    private Duration dedupRetention = Duration.ofDays(14);
    private int listLimit = 15;
    private String workerId;
    private boolean ensureIndexesOnStartup = false;

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getLockLifetime() {
        return lockLifetime;
    }

    public void setLockLifetime(Duration lockLifetime) {
        this.lockLifetime = lockLifetime;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public Duration getDedupRetention() {
        return dedupRetention;
    }

    public void setDedupRetention(Duration dedupRetention) {
        this.dedupRetention = dedupRetention;
    }

    public int getListLimit() {
        return listLimit;
    }

    public void setListLimit(int listLimit) {
        this.listLimit = listLimit;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
