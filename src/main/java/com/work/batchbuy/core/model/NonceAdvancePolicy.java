package com.work.batchbuy.core.model;

/**
 * approve 交易之后何时推进本地 nonce。buy 交易固定为发送成功即推进。
 */
public enum NonceAdvancePolicy {

    /**
     * 只有拿到 status=1 的 receipt 才推进。被打包但回滚的 approve 已消耗 nonce，
     * 之后的交易会因 nonce too low 被节点拒绝，仅在明确需要时开启。
     */
    CONFIRMED,

    /**
     * 默认。拿到 receipt 即推进（含 status=0），被打包的回滚交易同样消耗了 nonce。
     * 超时未确认时不推进，后续 buy 复用同一个 nonce。
     */
    INCLUDED,

    /**
     * 发送成功即推进，与 buy 一致。approve 最终被丢弃时后续交易会卡在 nonce 缺口上。
     */
    SENT
}
