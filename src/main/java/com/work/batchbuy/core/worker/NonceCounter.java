package com.work.batchbuy.core.worker;

import static com.work.batchbuy.core.support.ValidationUtils.requireNonNegative;

/**
 * 单账户本地 nonce 计数器，以链上 pending nonce 为起点，只增不减。
 * 只被所属 worker 线程访问，不做同步。
 */
public final class NonceCounter {

    private final long seed;
    private long next;

    public NonceCounter(long seed) {
        this.seed = requireNonNegative(seed, "seed");
        this.next = seed;
    }

    /**
     * 下一笔交易应使用的 nonce。
     */
    public long current() {
        return next;
    }

    /**
     * 当前 nonce 已被消耗，推进到下一个。
     */
    public long advance() {
        return ++next;
    }

    public long getSeed() {
        return seed;
    }

    public long consumed() {
        return next - seed;
    }

    @Override
    public String toString() {
        return "NonceCounter{seed=" + seed + ", next=" + next + '}';
    }
}
