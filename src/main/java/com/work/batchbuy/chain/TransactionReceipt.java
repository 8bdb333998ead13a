package com.work.batchbuy.chain;

/**
 * 已打包交易的回执。出现回执即说明该 nonce 已被链消耗，success=false 表示执行回滚（status=0x0）。
 */
public final class TransactionReceipt {

    private final String txHash;
    private final long blockNumber;
    private final boolean success;

    public TransactionReceipt(String txHash, long blockNumber, boolean success) {
        this.txHash = txHash;
        this.blockNumber = blockNumber;
        this.success = success;
    }

    public String getTxHash() {
        return txHash;
    }

    /**
     * 节点未返回区块号时为 -1。
     */
    public long getBlockNumber() {
        return blockNumber;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public String toString() {
        return "TransactionReceipt{txHash='" + txHash + "', block=" + blockNumber + ", success=" + success + '}';
    }
}
