package com.work.batchbuy.chain;

import java.math.BigInteger;
import java.util.Optional;

/**
 * 链上客户端抽象，每个实例绑定一个 RPC 出口（直连或某个代理）。
 *
 * 实现方把底层异常转换为组件异常：
 * - 连通性问题抛 {@link com.work.batchbuy.core.exception.ConnectivityException}
 * - nonce 查询失败抛 {@link com.work.batchbuy.core.exception.NonceFetchException}
 * - 只读调用失败抛 {@link com.work.batchbuy.core.exception.ContractCallException}
 * - 发送失败抛 {@link com.work.batchbuy.core.exception.SubmissionException}
 */
public interface ChainClient extends AutoCloseable {

    /**
     * 存活探测（web3_clientVersion）。
     */
    String clientVersion();

    /**
     * 查询地址 pending nonce（eth_getTransactionCount(pending)）。
     */
    long getPendingNonce(String address);

    BigInteger getGasPrice();

    /**
     * eth_call（latest），返回原始十六进制结果。
     */
    String call(String from, String to, String data);

    /**
     * 广播已签名交易，返回节点给出的 txHash。
     */
    String sendRawTransaction(String signedHex);

    /**
     * 查询交易回执（receipt）。如果交易尚未被打包，返回 empty。
     */
    Optional<TransactionReceipt> getTransactionReceipt(String txHash);

    @Override
    default void close() {
    }
}
