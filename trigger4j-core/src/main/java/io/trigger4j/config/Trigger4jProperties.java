package io.trigger4j.config;

import java.time.Duration;

/**
 * Runtime configuration for the scheduler, the lifecycle sweep and the recent-events cache.
 */
public class Trigger4jProperties {
    private Duration processEvery = Duration.ofSeconds(1); // scheduler poll resolution
    private int workerThreads = 4;
    private String timezone = "UTC"; // cron evaluation zone
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    private Duration sweepInterval = Duration.ofMinutes(30);
    private Duration archiveAfter = Duration.ofHours(2);
    private Duration deleteAfter = Duration.ofHours(48);

    private Duration recentCacheTtl = Duration.ofSeconds(60);
    private String recentCachePrefix = "recent_events:";
    private int maxPageSize = 100;

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public Duration getArchiveAfter() {
        return archiveAfter;
    }

    public void setArchiveAfter(Duration archiveAfter) {
        this.archiveAfter = archiveAfter;
    }

    public Duration getDeleteAfter() {
        return deleteAfter;
    }

    public void setDeleteAfter(Duration deleteAfter) {
        this.deleteAfter = deleteAfter;
    }

    public Duration getRecentCacheTtl() {
        return recentCacheTtl;
    }

    public void setRecentCacheTtl(Duration recentCacheTtl) {
        this.recentCacheTtl = recentCacheTtl;
    }

    public String getRecentCachePrefix() {
        return recentCachePrefix;
    }

    public void setRecentCachePrefix(String recentCachePrefix) {
        this.recentCachePrefix = recentCachePrefix;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }
}
