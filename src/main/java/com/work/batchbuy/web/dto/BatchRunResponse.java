package com.work.batchbuy.web.dto;

import java.util.List;

/**
 * 一次批量运行的汇总：账户数、总 approve / buy / 跳过的 approve，以及每个账户的结果。
 */
public class BatchRunResponse {

    private int accounts;
    private int totalApprovals;
    private int totalBuys;
    private int totalSkippedApprovals;
    private int faults;
    private List<WorkerResultView> results;

    public int getAccounts() {
        return accounts;
    }

    public void setAccounts(int accounts) {
        this.accounts = accounts;
    }

    public int getTotalApprovals() {
        return totalApprovals;
    }

    public void setTotalApprovals(int totalApprovals) {
        this.totalApprovals = totalApprovals;
    }

    public int getTotalBuys() {
        return totalBuys;
    }

    public void setTotalBuys(int totalBuys) {
        this.totalBuys = totalBuys;
    }

    public int getTotalSkippedApprovals() {
        return totalSkippedApprovals;
    }

    public void setTotalSkippedApprovals(int totalSkippedApprovals) {
        this.totalSkippedApprovals = totalSkippedApprovals;
    }

    public int getFaults() {
        return faults;
    }

    public void setFaults(int faults) {
        this.faults = faults;
    }

    public List<WorkerResultView> getResults() {
        return results;
    }

    public void setResults(List<WorkerResultView> results) {
        this.results = results;
    }
}
