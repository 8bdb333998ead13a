package com.work.batchbuy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * market 发现接口配置。
 */
@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {

    private String baseUrl = "https://api.limitless.exchange";

    private String frequency = "hourly";

    private int attempts = 3;

    private Duration timeout = Duration.ofSeconds(3);

    /**
     * 第 n 次失败后等待 n * retryBackoff。
     */
    private Duration retryBackoff = Duration.ofSeconds(1);

    private int parallelism = 10;

    /**
     * 币种 -> priceOracleId，保持配置顺序。
     */
    private Map<String, Integer> oracles = defaultOracles();

    private static Map<String, Integer> defaultOracles() {
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put("SOL", 59);
        m.put("BNB", 61);
        m.put("ETH", 58);
        m.put("DOGE", 60);
        m.put("XRP", 62);
        return m;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getFrequency() {
        return frequency;
    }

    public void setFrequency(String frequency) {
        this.frequency = frequency;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public Map<String, Integer> getOracles() {
        return oracles;
    }

    public void setOracles(Map<String, Integer> oracles) {
        this.oracles = oracles;
    }
}
