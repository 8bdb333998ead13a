package com.work.batchbuy.core.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口，业务/平台可通过自定义 Bean 接入具体实现。
 */
public interface BatchMetrics {

    /**
     * @param kind   approve / buy
     * @param result sent / already_known / failed
     */
    default void submission(String kind, String result) {
    }

    default void sendAttempt(int attempt) {
    }

    /**
     * @param result confirmed / reverted / unconfirmed
     */
    default void receiptWait(String result) {
    }

    /**
     * @param result sufficient / insufficient / unknown
     */
    default void allowanceCheck(String result) {
    }

    /**
     * @param state DONE / FAILED
     */
    default void workerFinished(String state) {
    }

    default void taskFault() {
    }
}
