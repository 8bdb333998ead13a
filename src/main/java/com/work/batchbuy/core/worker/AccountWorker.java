package com.work.batchbuy.core.worker;

import com.work.batchbuy.chain.ChainClient;
import com.work.batchbuy.chain.ChainClientFactory;
import com.work.batchbuy.config.BatchProperties;
import com.work.batchbuy.core.exception.ConnectivityException;
import com.work.batchbuy.core.exception.NonceFetchException;
import com.work.batchbuy.core.metrics.BatchMetrics;
import com.work.batchbuy.core.model.Account;
import com.work.batchbuy.core.model.BuyOrder;
import com.work.batchbuy.core.model.MarketTargets;
import com.work.batchbuy.core.model.NonceAdvancePolicy;
import com.work.batchbuy.core.model.WorkerResult;
import com.work.batchbuy.core.model.WorkerState;
import com.work.batchbuy.core.submission.SubmissionPipeline;
import com.work.batchbuy.core.submission.SubmissionResult;
import com.work.batchbuy.core.support.Addresses;
import com.work.batchbuy.core.support.Pacer;
import com.work.batchbuy.core.support.TokenAmounts;
import com.work.batchbuy.core.token.AllowanceOracle;
import com.work.batchbuy.core.token.Sufficiency;
import com.work.batchbuy.core.token.TokenReader;
import com.work.batchbuy.core.tx.SignedPayload;
import com.work.batchbuy.core.tx.TransactionBuilder;
import com.work.batchbuy.core.tx.TransactionIntent;
import com.work.batchbuy.core.tx.TransactionSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * 单账户顺序执行的状态机：INIT -> RUNNING -> DONE，启动阶段失败则 INIT -> FAILED。
 *
 * 对每个 market 依次：
 * 1. 余额门槛：余额不足直接跳过该 market（不 approve、不 buy）
 * 2. 授权：allowance 已足够则跳过并计数；否则发送 approve 并短暂等待回执，失败不阻塞 buy
 * 3. 购买：发送 buy 后不等回执，发送成功即推进 nonce，然后按 think-time 节流
 *
 * 本账户的 nonce 计数器只在此线程内读写；账户内所有提交严格串行。
 */
public class AccountWorker implements Callable<WorkerResult> {

    private static final Logger log = LoggerFactory.getLogger(AccountWorker.class);

    private static final String DIRECT = "DIRECT";

    private final String privateKey;
    private final String proxyUrl;
    private final MarketTargets targets;
    private final BuyOrder order;
    private final ChainClientFactory clientFactory;
    private final SubmissionPipeline pipeline;
    private final TransactionBuilder builder;
    private final TransactionSigner signer;
    private final BatchProperties props;
    private final Pacer pacer;
    private final BatchMetrics metrics;
    private final String explorerTxUrl;

    private volatile WorkerState state = WorkerState.INIT;

    public AccountWorker(String privateKey,
                         String proxyUrl,
                         MarketTargets targets,
                         BuyOrder order,
                         ChainClientFactory clientFactory,
                         SubmissionPipeline pipeline,
                         TransactionBuilder builder,
                         TransactionSigner signer,
                         BatchProperties props,
                         Pacer pacer,
                         BatchMetrics metrics,
                         String explorerTxUrl) {
        this.privateKey = privateKey;
        this.proxyUrl = proxyUrl;
        this.targets = targets;
        this.order = order;
        this.clientFactory = clientFactory;
        this.pipeline = pipeline;
        this.builder = builder;
        this.signer = signer;
        this.props = props;
        this.pacer = pacer;
        this.metrics = metrics;
        this.explorerTxUrl = explorerTxUrl == null ? "" : explorerTxUrl;
    }

    public WorkerState getState() {
        return state;
    }

    @Override
    public WorkerResult call() {
        Account account = Account.fromPrivateKey(privateKey);
        String address = account.getAddress();
        String tag = Addresses.shortTag(address);
        String via = proxyUrl == null ? DIRECT : proxyUrl;

        ChainClient client;
        try {
            client = clientFactory.create(proxyUrl);
        } catch (ConnectivityException e) {
            log.warn("[{}] RPC connect failed. proxy={} err={}", tag, via, e.getMessage());
            return fail(address, e.getMessage());
        }

        try (ChainClient c = client) {
            long seed;
            try {
                seed = c.getPendingNonce(address);
            } catch (NonceFetchException e) {
                log.warn("[{}] Nonce fetch failed. proxy={} err={}", tag, via, e.getMessage());
                return fail(address, e.getMessage());
            }

            Run run = new Run(account, tag, c, new NonceCounter(seed),
                    new TokenReader(c, order.getTokenAddress()));
            state = WorkerState.RUNNING;
            log.info("[{}] Started. proxy={} nonce={} targets={}", tag, via, seed, targets.size());

            for (Map.Entry<Integer, List<String>> group : targets.asMap().entrySet()) {
                for (String market : group.getValue()) {
                    processTarget(run, group.getKey(), market);
                }
            }

            state = WorkerState.DONE;
            metrics.workerFinished(WorkerState.DONE.name());
            log.info("[{}] Finished. approve={} buy={} skippedApprove={} nonce={}",
                    tag, run.approvalsSent, run.buysSent, run.approvalsSkipped, run.nonce.current());
            return WorkerResult.done(address, run.approvalsSent, run.buysSent, run.approvalsSkipped);
        }
    }

    private WorkerResult fail(String address, String reason) {
        state = WorkerState.FAILED;
        metrics.workerFinished(WorkerState.FAILED.name());
        return WorkerResult.failed(address, reason);
    }

    private void processTarget(Run run, Integer group, String rawMarket) {
        String market;
        try {
            market = Addresses.toChecksum(rawMarket);
        } catch (IllegalArgumentException e) {
            log.warn("[{}] Invalid market skipped. group={} market={}", run.tag, group, rawMarket);
            return;
        }

        try {
            if (checkBalance(run) != Sufficiency.SUFFICIENT) {
                return;
            }
            if (props.isApproveEnabled()) {
                approve(run, market);
            }
            if (props.isBuyEnabled()) {
                buy(run, market);
            }
        } catch (RuntimeException e) {
            log.warn("[{}] Target aborted. group={} market={} nonce={}", run.tag, group, market, run.nonce.current(), e);
            pacer.pause(props.getFailurePause());
        }
    }

    private Sufficiency checkBalance(Run run) {
        BigInteger balance;
        try {
            balance = run.tokenReader.balanceOf(run.account.getAddress());
        } catch (RuntimeException e) {
            log.warn("[{}] Balance query failed, target skipped. err={}", run.tag, e.getMessage());
            pacer.pause(props.getFailurePause());
            return Sufficiency.UNKNOWN;
        }
        if (balance.compareTo(order.getInvestmentAmount()) < 0) {
            log.warn("[{}] Insufficient balance, target skipped. balance={} need={}", run.tag,
                    TokenAmounts.toHuman(balance, order.getTokenDecimals()).toPlainString(),
                    TokenAmounts.toHuman(order.getInvestmentAmount(), order.getTokenDecimals()).toPlainString());
            return Sufficiency.INSUFFICIENT;
        }
        return Sufficiency.SUFFICIENT;
    }

    private void approve(Run run, String market) {
        if (props.isCheckAllowance() && run.allowanceOracle.sufficient(run.account.getAddress(), market)) {
            run.approvalsSkipped++;
            log.info("[{}] Approve skipped, allowance sufficient. spender={}", run.tag, market);
            return;
        }

        BigInteger amount = props.isUseMaxAllowance() ? AllowanceOracle.MAX_UINT256 : AllowanceOracle.DEFAULT_THRESHOLD;
        long nonce = run.nonce.current();
        SignedPayload payload;
        try {
            TransactionIntent intent = builder.buildApprove(order.getTokenAddress(), market, amount, nonce, run.client.getGasPrice());
            payload = signer.sign(intent, run.account);
        } catch (RuntimeException e) {
            log.warn("[{}] Approve build failed. spender={} nonce={} err={}", run.tag, market, nonce, e.getMessage());
            pacer.pause(props.getFailurePause());
            return;
        }

        SubmissionResult sent = pipeline.sendWithRetry(run.client, payload);
        if (!sent.isSent()) {
            log.warn("[{}] Approve send failed, continue to buy. spender={} nonce={} err={}",
                    run.tag, market, nonce, sent.getError());
            pacer.pause(props.getFailurePause());
            return;
        }
        log.info("[{}] APPROVE sent {} -> {} (nonce={})", run.tag, link(sent.getTxHash()), market, nonce);

        NonceAdvancePolicy policy = props.getApproveNonceAdvance();
        if (policy == NonceAdvancePolicy.SENT) {
            run.nonce.advance();
        }

        SubmissionResult inclusion = pipeline.awaitInclusion(run.client, sent.getTxHash(),
                props.getApproveReceiptTimeout(), props.getApproveReceiptPollInterval());
        switch (inclusion.getStatus()) {
            case CONFIRMED:
                if (policy != NonceAdvancePolicy.SENT) {
                    run.nonce.advance();
                }
                run.approvalsSent++;
                log.info("[{}] APPROVE confirmed. txHash={} block={}", run.tag, sent.getTxHash(),
                        inclusion.getReceipt().getBlockNumber());
                break;
            case REVERTED:
                if (policy == NonceAdvancePolicy.INCLUDED) {
                    run.nonce.advance();
                }
                log.warn("[{}] APPROVE reverted (status=0). {}", run.tag, link(sent.getTxHash()));
                break;
            default:
                log.warn("[{}] APPROVE not confirmed within {}ms. txHash={} policy={}", run.tag,
                        props.getApproveReceiptTimeout().toMillis(), sent.getTxHash(), policy);
                break;
        }
    }

    private void buy(Run run, String market) {
        long nonce = run.nonce.current();
        SignedPayload payload;
        try {
            TransactionIntent intent = builder.buildBuy(market, order, nonce, run.client.getGasPrice());
            payload = signer.sign(intent, run.account);
        } catch (RuntimeException e) {
            log.warn("[{}] Buy build failed. market={} nonce={} err={}", run.tag, market, nonce, e.getMessage());
            pacer.pause(props.getFailurePause());
            return;
        }

        SubmissionResult sent = pipeline.sendWithRetry(run.client, payload);
        if (!sent.isSent()) {
            log.warn("[{}] Buy send failed. market={} nonce={} err={}", run.tag, market, nonce, sent.getError());
            pacer.pause(props.getFailurePause());
            return;
        }
        run.nonce.advance();
        run.buysSent++;
        log.info("[{}] BUY sent {} -> {} outcome={} invest={} (nonce={})", run.tag, link(sent.getTxHash()),
                market, order.getOutcomeIndex(), order.getInvestmentAmount(), nonce);
        pacer.pause(props.getThinkTime(), props.getThinkJitter());
    }

    private String link(String txHash) {
        return explorerTxUrl + txHash;
    }

    /**
     * 单次运行的可变状态，只在 worker 线程内使用。
     */
    private final class Run {
        final Account account;
        final String tag;
        final ChainClient client;
        final NonceCounter nonce;
        final TokenReader tokenReader;
        final AllowanceOracle allowanceOracle;

        int approvalsSent;
        int buysSent;
        int approvalsSkipped;

        Run(Account account, String tag, ChainClient client, NonceCounter nonce, TokenReader tokenReader) {
            this.account = account;
            this.tag = tag;
            this.client = client;
            this.nonce = nonce;
            this.tokenReader = tokenReader;
            this.allowanceOracle = new AllowanceOracle(tokenReader, AllowanceOracle.DEFAULT_THRESHOLD, metrics);
        }
    }
}
