package com.work.batchbuy.core.worker;

import com.work.batchbuy.chain.ChainClientFactory;
import com.work.batchbuy.config.BatchProperties;
import com.work.batchbuy.core.metrics.BatchMetrics;
import com.work.batchbuy.core.model.BuyOrder;
import com.work.batchbuy.core.model.MarketTargets;
import com.work.batchbuy.core.model.WorkerResult;
import com.work.batchbuy.core.submission.SubmissionPipeline;
import com.work.batchbuy.core.support.Pacer;
import com.work.batchbuy.core.tx.TransactionBuilder;
import com.work.batchbuy.core.tx.TransactionSigner;

import java.util.concurrent.Callable;

import static com.work.batchbuy.core.support.ValidationUtils.requireNonNull;

public class DefaultAccountWorkerFactory implements AccountWorkerFactory {

    private final ChainClientFactory clientFactory;
    private final SubmissionPipeline pipeline;
    private final TransactionBuilder builder;
    private final TransactionSigner signer;
    private final BatchProperties props;
    private final Pacer pacer;
    private final BatchMetrics metrics;
    private final String explorerTxUrl;

    public DefaultAccountWorkerFactory(ChainClientFactory clientFactory,
                                       SubmissionPipeline pipeline,
                                       TransactionBuilder builder,
                                       TransactionSigner signer,
                                       BatchProperties props,
                                       Pacer pacer,
                                       BatchMetrics metrics,
                                       String explorerTxUrl) {
        this.clientFactory = requireNonNull(clientFactory, "clientFactory");
        this.pipeline = requireNonNull(pipeline, "pipeline");
        this.builder = requireNonNull(builder, "builder");
        this.signer = requireNonNull(signer, "signer");
        this.props = requireNonNull(props, "props");
        this.pacer = requireNonNull(pacer, "pacer");
        this.metrics = requireNonNull(metrics, "metrics");
        this.explorerTxUrl = explorerTxUrl == null ? "" : explorerTxUrl;
    }

    @Override
    public Callable<WorkerResult> create(String privateKey, String proxyUrl, MarketTargets targets, BuyOrder order) {
        return new AccountWorker(privateKey, proxyUrl, targets, order,
                clientFactory, pipeline, builder, signer, props, pacer, metrics, explorerTxUrl);
    }
}
