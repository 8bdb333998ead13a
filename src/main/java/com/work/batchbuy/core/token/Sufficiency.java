package com.work.batchbuy.core.token;

/**
 * 余额 / allowance 门槛检查的显式结果。UNKNOWN 表示查询失败。
 */
public enum Sufficiency {
    SUFFICIENT,
    INSUFFICIENT,
    UNKNOWN
}
