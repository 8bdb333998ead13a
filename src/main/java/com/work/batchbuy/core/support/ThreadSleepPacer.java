package com.work.batchbuy.core.support;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public class ThreadSleepPacer implements Pacer {

    @Override
    public void pause(Duration base, Duration jitter) {
        long millis = base == null ? 0L : Math.max(0L, base.toMillis());
        if (jitter != null && jitter.toMillis() > 0) {
            millis += ThreadLocalRandom.current().nextLong(jitter.toMillis());
        }
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            // 不对外暴露取消，只恢复中断标记，由调用方在下一次阻塞点感知
            Thread.currentThread().interrupt();
        }
    }
}
