package com.work.batchbuy.web.dto;

public class WorkerResultView {

    private String address;
    private String state;
    private int approvalsSent;
    private int buysSent;
    private int approvalsSkipped;
    private String failureReason;

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public int getApprovalsSent() {
        return approvalsSent;
    }

    public void setApprovalsSent(int approvalsSent) {
        this.approvalsSent = approvalsSent;
    }

    public int getBuysSent() {
        return buysSent;
    }

    public void setBuysSent(int buysSent) {
        this.buysSent = buysSent;
    }

    public int getApprovalsSkipped() {
        return approvalsSkipped;
    }

    public void setApprovalsSkipped(int approvalsSkipped) {
        this.approvalsSkipped = approvalsSkipped;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }
}
