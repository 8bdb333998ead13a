package com.work.batchbuy.core.exception;

/**
 * RPC 节点不可达（连通性探测失败），只影响当前账户的启动。
 */
public class ConnectivityException extends BatchException {

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
