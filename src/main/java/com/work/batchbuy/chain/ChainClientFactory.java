package com.work.batchbuy.chain;

/**
 * 按出口构建链客户端，并做一次存活探测。不做重试，由调用方决定如何处理失败。
 */
@FunctionalInterface
public interface ChainClientFactory {

    /**
     * @param proxyUrl 代理地址，null 表示直连
     * @throws com.work.batchbuy.core.exception.ConnectivityException 探测失败
     */
    ChainClient create(String proxyUrl);
}
