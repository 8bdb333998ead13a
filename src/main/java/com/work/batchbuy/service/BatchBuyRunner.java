package com.work.batchbuy.service;

import com.work.batchbuy.config.BatchProperties;
import com.work.batchbuy.core.model.BatchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * batch.run-on-startup=true 时，启动后按配置执行一次：
 * 配置了 batch.markets 则直接操作这些 market，否则按 discovery.oracles 自动发现。
 */
@Component
@ConditionalOnProperty(prefix = "batch", name = "run-on-startup", havingValue = "true")
public class BatchBuyRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchBuyRunner.class);

    private final BatchProperties props;
    private final BatchBuyService service;

    public BatchBuyRunner(BatchProperties props, BatchBuyService service) {
        this.props = props;
        this.service = service;
    }

    @Override
    public void run(ApplicationArguments args) {
        BatchSummary summary;
        if (props.getMarkets() != null && !props.getMarkets().isEmpty()) {
            summary = service.runForMarkets(props.getMarkets(), props.getInvestment(), props.getOutcomeIndex());
        } else {
            summary = service.runDiscovered(props.getInvestment(), props.getOutcomeIndex());
        }
        log.info("Startup run finished. {}", summary);
    }
}
