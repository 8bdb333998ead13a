package com.work.batchbuy.core.exception;

/**
 * eth_sendRawTransaction 失败（RPC 报错或网络异常），可在有限次数内重试。
 */
public class SubmissionException extends BatchException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
