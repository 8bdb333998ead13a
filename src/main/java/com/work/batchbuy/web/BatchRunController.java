package com.work.batchbuy.web;

import com.work.batchbuy.core.exception.BatchException;
import com.work.batchbuy.core.model.BatchSummary;
import com.work.batchbuy.core.model.WorkerResult;
import com.work.batchbuy.discovery.DiscoveredMarket;
import com.work.batchbuy.discovery.MarketDiscoveryService;
import com.work.batchbuy.service.BatchBuyService;
import com.work.batchbuy.web.dto.BatchRunRequest;
import com.work.batchbuy.web.dto.BatchRunResponse;
import com.work.batchbuy.web.dto.WorkerResultView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 同步执行一次批量 approve + buy，返回汇总；另提供 market 发现查询。
 */
@RestController
@RequestMapping("/api/v1/batch")
public class BatchRunController {

    private final BatchBuyService batchBuyService;
    private final MarketDiscoveryService discoveryService;

    public BatchRunController(BatchBuyService batchBuyService, MarketDiscoveryService discoveryService) {
        this.batchBuyService = batchBuyService;
        this.discoveryService = discoveryService;
    }

    @PostMapping("/runs")
    public ResponseEntity<BatchRunResponse> run(@Validated @RequestBody BatchRunRequest req) {
        BatchSummary summary = batchBuyService.runForMarkets(req.getMarkets(), req.getInvestment(),
                req.getOutcomeIndex(), req.getMinOutcomeTokens(), null, req.getMaxWorkers());
        return ResponseEntity.ok(toResponse(summary));
    }

    @GetMapping("/markets")
    public ResponseEntity<List<DiscoveredMarket>> markets() {
        return ResponseEntity.ok(discoveryService.discoverConfigured());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage());
    }

    @ExceptionHandler(BatchException.class)
    public ResponseEntity<String> handleBatchFailure(BatchException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(e.getMessage());
    }

    private BatchRunResponse toResponse(BatchSummary summary) {
        BatchRunResponse resp = new BatchRunResponse();
        resp.setAccounts(summary.getAccountCount());
        resp.setTotalApprovals(summary.getTotalApprovals());
        resp.setTotalBuys(summary.getTotalBuys());
        resp.setTotalSkippedApprovals(summary.getTotalSkipped());
        resp.setFaults(summary.getFaults());
        List<WorkerResultView> views = new ArrayList<>(summary.getResults().size());
        for (WorkerResult r : summary.getResults()) {
            WorkerResultView v = new WorkerResultView();
            v.setAddress(r.getAddress());
            v.setState(r.getState().name());
            v.setApprovalsSent(r.getApprovalsSent());
            v.setBuysSent(r.getBuysSent());
            v.setApprovalsSkipped(r.getApprovalsSkipped());
            v.setFailureReason(r.getFailureReason());
            views.add(v);
        }
        resp.setResults(views);
        return resp;
    }
}
