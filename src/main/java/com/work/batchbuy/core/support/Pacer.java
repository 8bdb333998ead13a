package com.work.batchbuy.core.support;

import java.time.Duration;

/**
 * 节流/退避等待的端口。生产实现为线程休眠，测试中可替换为记录型实现。
 */
public interface Pacer {

    /**
     * 等待 base + [0, jitter) 的随机时长。
     */
    void pause(Duration base, Duration jitter);

    default void pause(Duration base) {
        pause(base, Duration.ZERO);
    }
}
