package com.work.batchbuy.core.tx;

/**
 * 已签名的原始交易。txHash 由签名字节本地计算（keccak256），发送前即可确定。
 */
public final class SignedPayload {

    private final TransactionIntent intent;
    private final String rawHex;
    private final String txHash;

    public SignedPayload(TransactionIntent intent, String rawHex, String txHash) {
        this.intent = intent;
        this.rawHex = rawHex;
        this.txHash = txHash;
    }

    public TransactionIntent getIntent() {
        return intent;
    }

    public String getRawHex() {
        return rawHex;
    }

    public String getTxHash() {
        return txHash;
    }
}
