package com.work.batchbuy.core.submission;

import com.work.batchbuy.chain.TransactionReceipt;

/**
 * 发送 / 等待回执的显式结果，替代“异常即跳过”的控制流。
 */
public final class SubmissionResult {

    public enum Status {
        /**
         * 节点已接收，未等待回执。
         */
        SENT,
        /**
         * 重试耗尽仍发送失败，nonce 未被消耗。
         */
        SEND_FAILED,
        /**
         * 已打包且 status=1。
         */
        CONFIRMED,
        /**
         * 已打包但 status=0（合约回滚）。
         */
        REVERTED,
        /**
         * 超时仍未见回执。
         */
        UNCONFIRMED
    }

    private final Status status;
    private final String txHash;
    private final int attempts;
    private final String error;
    private final TransactionReceipt receipt;

    private SubmissionResult(Status status, String txHash, int attempts, String error, TransactionReceipt receipt) {
        this.status = status;
        this.txHash = txHash;
        this.attempts = attempts;
        this.error = error;
        this.receipt = receipt;
    }

    public static SubmissionResult sent(String txHash, int attempts) {
        return new SubmissionResult(Status.SENT, txHash, attempts, null, null);
    }

    public static SubmissionResult sendFailed(String error, int attempts) {
        return new SubmissionResult(Status.SEND_FAILED, null, attempts, error, null);
    }

    public static SubmissionResult included(TransactionReceipt receipt) {
        return new SubmissionResult(receipt.isSuccess() ? Status.CONFIRMED : Status.REVERTED,
                receipt.getTxHash(), 0, null, receipt);
    }

    public static SubmissionResult unconfirmed(String txHash) {
        return new SubmissionResult(Status.UNCONFIRMED, txHash, 0, null, null);
    }

    public boolean isSent() {
        return status != Status.SEND_FAILED;
    }

    public boolean isIncluded() {
        return status == Status.CONFIRMED || status == Status.REVERTED;
    }

    public Status getStatus() {
        return status;
    }

    public String getTxHash() {
        return txHash;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getError() {
        return error;
    }

    public TransactionReceipt getReceipt() {
        return receipt;
    }

    @Override
    public String toString() {
        return "SubmissionResult{" +
                "status=" + status +
                ", txHash='" + txHash + '\'' +
                ", attempts=" + attempts +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
