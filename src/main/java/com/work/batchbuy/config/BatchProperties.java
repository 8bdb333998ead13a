package com.work.batchbuy.config;

import com.work.batchbuy.core.model.NonceAdvancePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 批量授权 + 购买的运行参数。
 */
@ConfigurationProperties(prefix = "batch")
public class BatchProperties {

    /**
     * 并发账户数（线程池宽度）。
     */
    private int maxWorkers = 24;

    /**
     * 需要授权、同时作为 investment token 的 ERC20（默认 Base USDC）。
     */
    private String tokenAddress = "0x833589fcd6edb6e08f4c7c32d4f71b54bda02913";

    private int tokenDecimals = 6;

    private boolean approveEnabled = true;

    private boolean buyEnabled = true;

    /**
     * 授权前先查 allowance。账户很多时建议关闭以减少 429。
     */
    private boolean checkAllowance = true;

    /**
     * true: 授权 2^256-1；false: 授权阈值（2^255-1）。
     */
    private boolean useMaxAllowance = true;

    private long gasLimitApprove = 120_000L;

    private long gasLimitBuy = 250_000L;

    /**
     * 单笔交易最多发送次数（含首次）。
     */
    private int sendRetries = 2;

    /**
     * 第 n 次失败后等待 n * retryBackoff + [0, retryJitter)。
     */
    private Duration retryBackoff = Duration.ofSeconds(5);

    private Duration retryJitter = Duration.ofSeconds(1);

    /**
     * 同一账户两次 buy 之间的间隔与抖动，降低 RPC 限流压力。
     */
    private Duration thinkTime = Duration.ofMillis(800);

    private Duration thinkJitter = Duration.ofMillis(400);

    /**
     * 单步失败后的短暂停顿。
     */
    private Duration failurePause = Duration.ofMillis(500);

    private Duration approveReceiptTimeout = Duration.ofSeconds(5);

    private Duration approveReceiptPollInterval = Duration.ofSeconds(3);

    private NonceAdvancePolicy approveNonceAdvance = NonceAdvancePolicy.INCLUDED;

    private BigDecimal investment = new BigDecimal("0.1");

    private int outcomeIndex = 0;

    private BigDecimal minOutcomeTokens = BigDecimal.ZERO;

    private String privateKeysFile = "private_keys.txt";

    private String proxiesFile = "proxies.txt";

    /**
     * 非交互运行时直接操作的 market 地址；为空则按 discovery.oracles 自动发现。
     */
    private List<String> markets = new ArrayList<>();

    private boolean runOnStartup = false;

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public String getTokenAddress() {
        return tokenAddress;
    }

    public void setTokenAddress(String tokenAddress) {
        this.tokenAddress = tokenAddress;
    }

    public int getTokenDecimals() {
        return tokenDecimals;
    }

    public void setTokenDecimals(int tokenDecimals) {
        this.tokenDecimals = tokenDecimals;
    }

    public boolean isApproveEnabled() {
        return approveEnabled;
    }

    public void setApproveEnabled(boolean approveEnabled) {
        this.approveEnabled = approveEnabled;
    }

    public boolean isBuyEnabled() {
        return buyEnabled;
    }

    public void setBuyEnabled(boolean buyEnabled) {
        this.buyEnabled = buyEnabled;
    }

    public boolean isCheckAllowance() {
        return checkAllowance;
    }

    public void setCheckAllowance(boolean checkAllowance) {
        this.checkAllowance = checkAllowance;
    }

    public boolean isUseMaxAllowance() {
        return useMaxAllowance;
    }

    public void setUseMaxAllowance(boolean useMaxAllowance) {
        this.useMaxAllowance = useMaxAllowance;
    }

    public long getGasLimitApprove() {
        return gasLimitApprove;
    }

    public void setGasLimitApprove(long gasLimitApprove) {
        this.gasLimitApprove = gasLimitApprove;
    }

    public long getGasLimitBuy() {
        return gasLimitBuy;
    }

    public void setGasLimitBuy(long gasLimitBuy) {
        this.gasLimitBuy = gasLimitBuy;
    }

    public int getSendRetries() {
        return sendRetries;
    }

    public void setSendRetries(int sendRetries) {
        this.sendRetries = sendRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public Duration getRetryJitter() {
        return retryJitter;
    }

    public void setRetryJitter(Duration retryJitter) {
        this.retryJitter = retryJitter;
    }

    public Duration getThinkTime() {
        return thinkTime;
    }

    public void setThinkTime(Duration thinkTime) {
        this.thinkTime = thinkTime;
    }

    public Duration getThinkJitter() {
        return thinkJitter;
    }

    public void setThinkJitter(Duration thinkJitter) {
        this.thinkJitter = thinkJitter;
    }

    public Duration getFailurePause() {
        return failurePause;
    }

    public void setFailurePause(Duration failurePause) {
        this.failurePause = failurePause;
    }

    public Duration getApproveReceiptTimeout() {
        return approveReceiptTimeout;
    }

    public void setApproveReceiptTimeout(Duration approveReceiptTimeout) {
        this.approveReceiptTimeout = approveReceiptTimeout;
    }

    public Duration getApproveReceiptPollInterval() {
        return approveReceiptPollInterval;
    }

    public void setApproveReceiptPollInterval(Duration approveReceiptPollInterval) {
        this.approveReceiptPollInterval = approveReceiptPollInterval;
    }

    public NonceAdvancePolicy getApproveNonceAdvance() {
        return approveNonceAdvance;
    }

    public void setApproveNonceAdvance(NonceAdvancePolicy approveNonceAdvance) {
        this.approveNonceAdvance = approveNonceAdvance;
    }

    public BigDecimal getInvestment() {
        return investment;
    }

    public void setInvestment(BigDecimal investment) {
        this.investment = investment;
    }

    public int getOutcomeIndex() {
        return outcomeIndex;
    }

    public void setOutcomeIndex(int outcomeIndex) {
        this.outcomeIndex = outcomeIndex;
    }

    public BigDecimal getMinOutcomeTokens() {
        return minOutcomeTokens;
    }

    public void setMinOutcomeTokens(BigDecimal minOutcomeTokens) {
        this.minOutcomeTokens = minOutcomeTokens;
    }

    public String getPrivateKeysFile() {
        return privateKeysFile;
    }

    public void setPrivateKeysFile(String privateKeysFile) {
        this.privateKeysFile = privateKeysFile;
    }

    public String getProxiesFile() {
        return proxiesFile;
    }

    public void setProxiesFile(String proxiesFile) {
        this.proxiesFile = proxiesFile;
    }

    public List<String> getMarkets() {
        return markets;
    }

    public void setMarkets(List<String> markets) {
        this.markets = markets;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }
}
