package com.work.batchbuy.core.exception;

/**
 * 无法获取账户的 pending nonce，该账户本次不做任何操作。
 */
public class NonceFetchException extends BatchException {

    public NonceFetchException(String message) {
        super(message);
    }

    public NonceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
