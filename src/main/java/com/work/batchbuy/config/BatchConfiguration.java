package com.work.batchbuy.config;

import com.work.batchbuy.chain.ChainClientFactory;
import com.work.batchbuy.core.metrics.BatchMetrics;
import com.work.batchbuy.core.metrics.NoopBatchMetrics;
import com.work.batchbuy.core.orchestrator.BatchOrchestrator;
import com.work.batchbuy.core.submission.SubmissionPipeline;
import com.work.batchbuy.core.support.Pacer;
import com.work.batchbuy.core.support.ThreadSleepPacer;
import com.work.batchbuy.core.tx.TransactionBuilder;
import com.work.batchbuy.core.tx.TransactionSigner;
import com.work.batchbuy.core.worker.AccountWorkerFactory;
import com.work.batchbuy.core.worker.DefaultAccountWorkerFactory;
import com.work.batchbuy.discovery.MarketDiscoveryClient;
import com.work.batchbuy.discovery.MarketDiscoveryService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * 将核心组件装配为 Spring Bean。核心类本身不依赖 Spring，测试中可直接 new。
 */
@Configuration
@EnableConfigurationProperties({BatchProperties.class, ChainProperties.class, DiscoveryProperties.class})
public class BatchConfiguration {

    @Bean
    @ConditionalOnMissingBean(BatchMetrics.class)
    public BatchMetrics batchMetrics() {
        return new NoopBatchMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(Pacer.class)
    public Pacer pacer() {
        return new ThreadSleepPacer();
    }

    @Bean
    public SubmissionPipeline submissionPipeline(BatchProperties props, Pacer pacer, BatchMetrics metrics) {
        return new SubmissionPipeline(props, pacer, metrics);
    }

    @Bean
    public TransactionBuilder transactionBuilder(ChainProperties chain, BatchProperties props) {
        return new TransactionBuilder(chain.getChainId(), props.getGasLimitApprove(), props.getGasLimitBuy());
    }

    @Bean
    public TransactionSigner transactionSigner() {
        return new TransactionSigner();
    }

    @Bean
    public AccountWorkerFactory accountWorkerFactory(ChainClientFactory clientFactory,
                                                     SubmissionPipeline pipeline,
                                                     TransactionBuilder builder,
                                                     TransactionSigner signer,
                                                     BatchProperties props,
                                                     ChainProperties chain,
                                                     Pacer pacer,
                                                     BatchMetrics metrics) {
        return new DefaultAccountWorkerFactory(clientFactory, pipeline, builder, signer, props, pacer, metrics,
                chain.getExplorerTxUrl());
    }

    @Bean
    public BatchOrchestrator batchOrchestrator(BatchProperties props, AccountWorkerFactory workerFactory, BatchMetrics metrics) {
        return new BatchOrchestrator(props, workerFactory, metrics);
    }

    @Bean
    public RestTemplate discoveryRestTemplate(RestTemplateBuilder builder, DiscoveryProperties discovery) {
        return builder
                .setConnectTimeout(discovery.getTimeout())
                .setReadTimeout(discovery.getTimeout())
                .build();
    }

    @Bean
    public MarketDiscoveryClient marketDiscoveryClient(RestTemplate discoveryRestTemplate, DiscoveryProperties discovery, Pacer pacer) {
        return new MarketDiscoveryClient(discoveryRestTemplate, discovery, pacer);
    }

    @Bean
    public MarketDiscoveryService marketDiscoveryService(MarketDiscoveryClient client, DiscoveryProperties discovery) {
        return new MarketDiscoveryService(client, discovery);
    }
}
