package com.work.batchbuy.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 全部 worker 结束后的汇总。results 按完成顺序排列；抛出未处理异常的任务只计入 faults。
 */
public final class BatchSummary {

    private final List<WorkerResult> results;
    private final int faults;

    public BatchSummary(List<WorkerResult> results, int faults) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.faults = faults;
    }

    public List<WorkerResult> getResults() {
        return results;
    }

    public int getAccountCount() {
        return results.size();
    }

    public int getFaults() {
        return faults;
    }

    public int getTotalApprovals() {
        return results.stream().mapToInt(WorkerResult::getApprovalsSent).sum();
    }

    public int getTotalBuys() {
        return results.stream().mapToInt(WorkerResult::getBuysSent).sum();
    }

    public int getTotalSkipped() {
        return results.stream().mapToInt(WorkerResult::getApprovalsSkipped).sum();
    }

    @Override
    public String toString() {
        return "BatchSummary{" +
                "accounts=" + getAccountCount() +
                ", approvals=" + getTotalApprovals() +
                ", buys=" + getTotalBuys() +
                ", skippedApprovals=" + getTotalSkipped() +
                ", faults=" + faults +
                '}';
    }
}
