package com.work.batchbuy.core.submission;

import com.work.batchbuy.chain.ChainClient;
import com.work.batchbuy.chain.TransactionReceipt;
import com.work.batchbuy.config.BatchProperties;
import com.work.batchbuy.core.metrics.BatchMetrics;
import com.work.batchbuy.core.support.Pacer;
import com.work.batchbuy.core.tx.SignedPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

import static com.work.batchbuy.core.support.ValidationUtils.requireNonEmpty;
import static com.work.batchbuy.core.support.ValidationUtils.requireNonNegative;
import static com.work.batchbuy.core.support.ValidationUtils.requireNonNull;
import static com.work.batchbuy.core.support.ValidationUtils.requirePositive;

/**
 * 交易提交管道：
 * - sendWithRetry：有界重试 + 线性退避；重试复用同一份签名数据（同 nonce）
 * - awaitInclusion：轮询 receipt，超时返回 UNCONFIRMED 而不是抛异常
 *
 * 无状态，可被所有 worker 共享。
 */
public class SubmissionPipeline {

    private static final Logger log = LoggerFactory.getLogger(SubmissionPipeline.class);

    private final int maxAttempts;
    private final Duration retryBackoff;
    private final Duration retryJitter;
    private final Pacer pacer;
    private final BatchMetrics metrics;

    public SubmissionPipeline(BatchProperties props, Pacer pacer, BatchMetrics metrics) {
        requireNonNull(props, "props");
        this.maxAttempts = requirePositive(props.getSendRetries(), "sendRetries");
        this.retryBackoff = requireNonNegative(props.getRetryBackoff(), "retryBackoff");
        this.retryJitter = requireNonNegative(props.getRetryJitter(), "retryJitter");
        this.pacer = requireNonNull(pacer, "pacer");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * 第 n 次失败后等待 n * retryBackoff + jitter 再重试；最后一次失败不再等待，直接返回 SEND_FAILED。
     */
    public SubmissionResult sendWithRetry(ChainClient client, SignedPayload payload) {
        requireNonNull(client, "client");
        requireNonNull(payload, "payload");
        String kind = payload.getIntent().getKind().name().toLowerCase(Locale.ROOT);
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            metrics.sendAttempt(attempt);
            try {
                String txHash = client.sendRawTransaction(payload.getRawHex());
                if (txHash == null || txHash.trim().isEmpty()) {
                    txHash = payload.getTxHash();
                }
                metrics.submission(kind, "sent");
                return SubmissionResult.sent(txHash, attempt);
            } catch (RuntimeException e) {
                if (isAlreadyKnown(e)) {
                    // 同一份签名数据已在节点交易池中（上一次其实已送达）
                    log.info("Raw tx already known by node. kind={} nonce={} txHash={}",
                            kind, payload.getIntent().getNonce(), payload.getTxHash());
                    metrics.submission(kind, "already_known");
                    return SubmissionResult.sent(payload.getTxHash(), attempt);
                }
                lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                if (attempt < maxAttempts) {
                    Duration wait = retryBackoff.multipliedBy(attempt);
                    log.warn("Send failed ({}/{}), retrying in {}ms + jitter. kind={} nonce={} err={}",
                            attempt, maxAttempts, wait.toMillis(), kind, payload.getIntent().getNonce(), lastError);
                    pacer.pause(wait, retryJitter);
                } else {
                    log.warn("Send failed ({}/{}), giving up. kind={} nonce={} err={}",
                            attempt, maxAttempts, kind, payload.getIntent().getNonce(), lastError);
                }
            }
        }
        metrics.submission(kind, "failed");
        return SubmissionResult.sendFailed(lastError, maxAttempts);
    }

    /**
     * 在 timeout 内按 pollInterval 轮询 receipt。第一次查询立即进行，最后一次查询落在超时点上。
     * 查询本身出错按“尚未出回执”处理。
     */
    public SubmissionResult awaitInclusion(ChainClient client, String txHash, Duration timeout, Duration pollInterval) {
        requireNonNull(client, "client");
        requireNonEmpty(txHash, "txHash");
        requireNonNegative(timeout, "timeout");
        requirePositive(pollInterval, "pollInterval");

        Duration remaining = timeout;
        while (true) {
            Optional<TransactionReceipt> receipt = queryReceipt(client, txHash);
            if (receipt.isPresent()) {
                SubmissionResult included = SubmissionResult.included(receipt.get());
                metrics.receiptWait(included.getStatus() == SubmissionResult.Status.CONFIRMED ? "confirmed" : "reverted");
                return included;
            }
            if (remaining.isZero() || remaining.isNegative()) {
                metrics.receiptWait("unconfirmed");
                return SubmissionResult.unconfirmed(txHash);
            }
            Duration nap = pollInterval.compareTo(remaining) < 0 ? pollInterval : remaining;
            pacer.pause(nap);
            remaining = remaining.minus(nap);
            if (Thread.currentThread().isInterrupted()) {
                metrics.receiptWait("unconfirmed");
                return SubmissionResult.unconfirmed(txHash);
            }
        }
    }

    private Optional<TransactionReceipt> queryReceipt(ChainClient client, String txHash) {
        try {
            Optional<TransactionReceipt> r = client.getTransactionReceipt(txHash);
            return r == null ? Optional.empty() : r;
        } catch (RuntimeException e) {
            log.debug("Receipt query failed, treat as not found. txHash={} err={}", txHash, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isAlreadyKnown(RuntimeException e) {
        String msg = e.getMessage();
        if (msg == null) {
            return false;
        }
        String m = msg.toLowerCase(Locale.ROOT);
        return m.contains("already known") || m.contains("known transaction");
    }
}
