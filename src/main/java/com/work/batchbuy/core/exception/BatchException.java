package com.work.batchbuy.core.exception;

/**
 * 组件内部的统⼀异常类型，便于按账户隔离处理。
 */
public class BatchException extends RuntimeException {

    public BatchException(String message) {
        super(message);
    }

    public BatchException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试解决（例如 RPC 发送失败、限流）。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
