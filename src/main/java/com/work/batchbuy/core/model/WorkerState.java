package com.work.batchbuy.core.model;

/**
 * 单账户 worker 状态机：INIT -> RUNNING -> DONE，或 INIT -> FAILED（启动阶段失败，无任何链上动作）。
 */
public enum WorkerState {
    INIT,
    RUNNING,
    DONE,
    FAILED
}
