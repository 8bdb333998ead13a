package com.work.batchbuy.core.orchestrator;

import com.work.batchbuy.config.BatchProperties;
import com.work.batchbuy.core.exception.BatchException;
import com.work.batchbuy.core.metrics.BatchMetrics;
import com.work.batchbuy.core.model.BatchSummary;
import com.work.batchbuy.core.model.BuyOrder;
import com.work.batchbuy.core.model.MarketTargets;
import com.work.batchbuy.core.model.WorkerResult;
import com.work.batchbuy.core.worker.AccountWorkerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.work.batchbuy.core.support.ValidationUtils.requireNonNull;
import static com.work.batchbuy.core.support.ValidationUtils.requirePositive;

/**
 * fan-out / fan-in：每个账户一个任务，提交到固定宽度的线程池，按完成顺序收集结果。
 *
 * - 代理按账户位置轮询分配
 * - 单个任务抛出的未处理异常只记日志并计入 faults，不中断整批
 * - 共享给任务的 targets / order / proxies 均为只读
 */
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final BatchProperties props;
    private final AccountWorkerFactory workerFactory;
    private final BatchMetrics metrics;

    public BatchOrchestrator(BatchProperties props, AccountWorkerFactory workerFactory, BatchMetrics metrics) {
        this.props = requireNonNull(props, "props");
        this.workerFactory = requireNonNull(workerFactory, "workerFactory");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    public BatchSummary run(List<String> privateKeys, List<String> proxies, MarketTargets targets, BuyOrder order) {
        return run(privateKeys, proxies, targets, order, props.getMaxWorkers());
    }

    /**
     * @param maxWorkers 本次运行的线程池宽度，覆盖配置值
     */
    public BatchSummary run(List<String> privateKeys, List<String> proxies, MarketTargets targets, BuyOrder order,
                            int maxWorkers) {
        requireNonNull(privateKeys, "privateKeys");
        requireNonNull(targets, "targets");
        requireNonNull(order, "order");
        List<String> proxyList = proxies == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(proxies));
        int width = requirePositive(maxWorkers, "maxWorkers");

        log.info("Batch start. accounts={} targets={} maxWorkers={} proxies={} order={}",
                privateKeys.size(), targets.size(), width, proxyList.isEmpty() ? "none" : proxyList.size(), order);
        if (privateKeys.isEmpty()) {
            return new BatchSummary(Collections.emptyList(), 0);
        }

        int threads = Math.min(width, privateKeys.size());
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                threads, threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory("batch-worker-"));
        CompletionService<WorkerResult> completion = new ExecutorCompletionService<>(pool);

        List<WorkerResult> results = new ArrayList<>(privateKeys.size());
        int faults = 0;
        try {
            for (int i = 0; i < privateKeys.size(); i++) {
                String proxy = ProxyRotation.forPosition(proxyList, i + 1);
                completion.submit(workerFactory.create(privateKeys.get(i), proxy, targets, order));
            }
            for (int i = 0; i < privateKeys.size(); i++) {
                Future<WorkerResult> f = completion.take();
                try {
                    WorkerResult r = f.get();
                    if (r != null) {
                        results.add(r);
                    }
                } catch (ExecutionException e) {
                    faults++;
                    metrics.taskFault();
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Account task failed: {}", cause.toString(), cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            throw new BatchException("batch interrupted after " + results.size() + " results", e);
        } finally {
            pool.shutdown();
        }

        BatchSummary summary = new BatchSummary(results, faults);
        log.info("====== Summary ====== accounts={} approvals={} buys={} skippedApprovals={} faults={}",
                summary.getAccountCount(), summary.getTotalApprovals(), summary.getTotalBuys(),
                summary.getTotalSkipped(), summary.getFaults());
        return summary;
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
