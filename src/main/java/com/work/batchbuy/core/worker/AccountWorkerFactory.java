package com.work.batchbuy.core.worker;

import com.work.batchbuy.core.model.BuyOrder;
import com.work.batchbuy.core.model.MarketTargets;
import com.work.batchbuy.core.model.WorkerResult;

import java.util.concurrent.Callable;

/**
 * 为单个账户创建任务。创建本身不做任何网络调用，私钥解析与连接都在任务执行时进行。
 */
@FunctionalInterface
public interface AccountWorkerFactory {

    /**
     * @param proxyUrl 为 null 时直连
     */
    Callable<WorkerResult> create(String privateKey, String proxyUrl, MarketTargets targets, BuyOrder order);
}
