package com.work.batchbuy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 链连接配置。
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * JSON-RPC 地址（Base 主网）。
     */
    private String rpcUrl = "https://mainnet.base.org";

    private long chainId = 8453L;

    /**
     * 单次 RPC 请求超时（connect/read/write 共用）。
     */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * 区块浏览器交易链接前缀，只用于日志。
     */
    private String explorerTxUrl = "https://basescan.org/tx/";

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public String getExplorerTxUrl() {
        return explorerTxUrl;
    }

    public void setExplorerTxUrl(String explorerTxUrl) {
        this.explorerTxUrl = explorerTxUrl;
    }
}
