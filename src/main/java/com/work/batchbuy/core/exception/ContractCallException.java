package com.work.batchbuy.core.exception;

/**
 * 只读合约调用（eth_call）失败或返回值无法解码。
 */
public class ContractCallException extends BatchException {

    public ContractCallException(String message) {
        super(message);
    }

    public ContractCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
