package com.taskwarden.pool;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "taskwarden.pool")
public class ServerPoolProperties {

    /** Platform used when callers do not name one; derived from os.name when blank. */
    private String platform;
    private long healthCheckTimeoutMs = 1000;
    private long pollIntervalMs = 250;
    private int maxWarmupFailures = 0;
    private Map<String, Platform> platforms = new LinkedHashMap<>();

    public String getPlatform() { return platform; }
    public void setPlatform(String platform) { this.platform = platform; }
    public long getHealthCheckTimeoutMs() { return healthCheckTimeoutMs; }
    public void setHealthCheckTimeoutMs(long healthCheckTimeoutMs) { this.healthCheckTimeoutMs = healthCheckTimeoutMs; }
    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    public int getMaxWarmupFailures() { return maxWarmupFailures; }
    public void setMaxWarmupFailures(int maxWarmupFailures) { this.maxWarmupFailures = maxWarmupFailures; }
    public Map<String, Platform> getPlatforms() { return platforms; }
    public void setPlatforms(Map<String, Platform> platforms) { this.platforms = platforms; }

    /**
     * Options for one platform; unset fields take the {@link PoolOptions} defaults.
     */
    public PoolOptions optionsFor(String platformName) {
        Platform p = platforms.get(platformName);
        if (p == null) {
            return PoolOptions.defaults();
        }
        return PoolOptions.resolve(p.minIdle, p.maxTotal, p.coldStartFallback, p.startupTimeoutMs, p.enabled);
    }

    public String resolvePlatform() {
        if (platform != null && !platform.isBlank()) {
            return platform;
        }
        return platformOf(System.getProperty("os.name", ""));
    }

    static String platformOf(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("win")) return "windows";
        if (os.contains("mac") || os.contains("darwin")) return "darwin";
        return "linux";
    }

    public static class Platform {
        private Integer minIdle;
        private Integer maxTotal;
        private Boolean coldStartFallback;
        private Long startupTimeoutMs;
        private Boolean enabled;

        public Integer getMinIdle() { return minIdle; }
        public void setMinIdle(Integer minIdle) { this.minIdle = minIdle; }
        public Integer getMaxTotal() { return maxTotal; }
        public void setMaxTotal(Integer maxTotal) { this.maxTotal = maxTotal; }
        public Boolean getColdStartFallback() { return coldStartFallback; }
        public void setColdStartFallback(Boolean coldStartFallback) { this.coldStartFallback = coldStartFallback; }
        public Long getStartupTimeoutMs() { return startupTimeoutMs; }
        public void setStartupTimeoutMs(Long startupTimeoutMs) { this.startupTimeoutMs = startupTimeoutMs; }
        public Boolean getEnabled() { return enabled; }
        public void setEnabled(Boolean enabled) { this.enabled = enabled; }
    }
}
