package com.work.batchbuy.core.tx;

import java.math.BigInteger;

/**
 * 待签名的交易意图（legacy gasPrice 交易）。value 恒为 0。
 * 同一步骤的重试复用同一个 intent，因此也复用同一个 nonce。
 */
public final class TransactionIntent {

    public enum Kind {
        APPROVE,
        BUY
    }

    private final Kind kind;
    private final String to;
    private final String data;
    private final BigInteger value;
    private final BigInteger nonce;
    private final BigInteger gasLimit;
    private final BigInteger gasPrice;
    private final long chainId;

    TransactionIntent(Kind kind, String to, String data, BigInteger nonce,
                      BigInteger gasLimit, BigInteger gasPrice, long chainId) {
        this.kind = kind;
        this.to = to;
        this.data = data;
        this.value = BigInteger.ZERO;
        this.nonce = nonce;
        this.gasLimit = gasLimit;
        this.gasPrice = gasPrice;
        this.chainId = chainId;
    }

    public Kind getKind() {
        return kind;
    }

    public String getTo() {
        return to;
    }

    public String getData() {
        return data;
    }

    public BigInteger getValue() {
        return value;
    }

    public BigInteger getNonce() {
        return nonce;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public long getChainId() {
        return chainId;
    }

    @Override
    public String toString() {
        return "TransactionIntent{" +
                "kind=" + kind +
                ", to='" + to + '\'' +
                ", nonce=" + nonce +
                ", gasLimit=" + gasLimit +
                ", gasPrice=" + gasPrice +
                ", chainId=" + chainId +
                '}';
    }
}
