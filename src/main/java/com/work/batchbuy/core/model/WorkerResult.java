package com.work.batchbuy.core.model;

/**
 * 单账户运行结果，worker 结束时创建一次，之后只读。
 */
public final class WorkerResult {

    private final String address;
    private final WorkerState state;
    private final int approvalsSent;
    private final int buysSent;
    private final int approvalsSkipped;
    private final String failureReason;

    private WorkerResult(String address, WorkerState state, int approvalsSent, int buysSent,
                         int approvalsSkipped, String failureReason) {
        this.address = address;
        this.state = state;
        this.approvalsSent = approvalsSent;
        this.buysSent = buysSent;
        this.approvalsSkipped = approvalsSkipped;
        this.failureReason = failureReason;
    }

    public static WorkerResult done(String address, int approvalsSent, int buysSent, int approvalsSkipped) {
        return new WorkerResult(address, WorkerState.DONE, approvalsSent, buysSent, approvalsSkipped, null);
    }

    /**
     * 启动阶段失败：零计数。
     */
    public static WorkerResult failed(String address, String reason) {
        return new WorkerResult(address, WorkerState.FAILED, 0, 0, 0, reason);
    }

    public String getAddress() {
        return address;
    }

    public WorkerState getState() {
        return state;
    }

    public int getApprovalsSent() {
        return approvalsSent;
    }

    public int getBuysSent() {
        return buysSent;
    }

    public int getApprovalsSkipped() {
        return approvalsSkipped;
    }

    public String getFailureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        return "WorkerResult{" +
                "address='" + address + '\'' +
                ", state=" + state +
                ", approvalsSent=" + approvalsSent +
                ", buysSent=" + buysSent +
                ", approvalsSkipped=" + approvalsSkipped +
                '}';
    }
}
