package com.work.batchbuy.service;

import com.work.batchbuy.config.BatchProperties;
import com.work.batchbuy.core.exception.BatchException;
import com.work.batchbuy.core.model.BatchSummary;
import com.work.batchbuy.core.model.BuyOrder;
import com.work.batchbuy.core.model.MarketTargets;
import com.work.batchbuy.core.orchestrator.BatchOrchestrator;
import com.work.batchbuy.core.support.Addresses;
import com.work.batchbuy.discovery.MarketDiscoveryService;
import com.work.batchbuy.input.AccountKeyLoader;
import com.work.batchbuy.input.ProxyListLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

import static com.work.batchbuy.core.support.ValidationUtils.requireNonEmpty;

/**
 * 非交互入口：加载私钥与代理，组装 targets / 参数，交给编排器执行。
 */
@Service
public class BatchBuyService {

    private static final Logger log = LoggerFactory.getLogger(BatchBuyService.class);

    private final BatchProperties props;
    private final BatchOrchestrator orchestrator;
    private final AccountKeyLoader keyLoader;
    private final ProxyListLoader proxyLoader;
    private final MarketDiscoveryService discoveryService;

    public BatchBuyService(BatchProperties props,
                           BatchOrchestrator orchestrator,
                           AccountKeyLoader keyLoader,
                           ProxyListLoader proxyLoader,
                           MarketDiscoveryService discoveryService) {
        this.props = props;
        this.orchestrator = orchestrator;
        this.keyLoader = keyLoader;
        this.proxyLoader = proxyLoader;
        this.discoveryService = discoveryService;
    }

    /**
     * 单个 market 的快捷入口。
     */
    public BatchSummary startByAddress(String market, BigDecimal investment, int outcomeIndex) {
        requireNonEmpty(market, "market");
        return runForMarkets(Collections.singletonList(market), investment, outcomeIndex);
    }

    public BatchSummary runForMarkets(List<String> markets, BigDecimal investment, int outcomeIndex) {
        return runForMarkets(markets, investment, outcomeIndex, props.getMinOutcomeTokens(), null, null);
    }

    /**
     * 传入的 market 列表整体作为一个分组（group 0），非法地址跳过、重复地址去重。
     *
     * @param proxies    为 null 时读取配置的代理文件
     * @param maxWorkers 为 null 时使用配置值
     */
    public BatchSummary runForMarkets(List<String> markets,
                                      BigDecimal investment,
                                      int outcomeIndex,
                                      BigDecimal minOutcomeTokens,
                                      List<String> proxies,
                                      Integer maxWorkers) {
        List<String> normalized = Addresses.toChecksumList(markets);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("没有可操作的 market 地址");
        }
        return execute(MarketTargets.single(normalized), investment, outcomeIndex, minOutcomeTokens, proxies, maxWorkers);
    }

    /**
     * 对配置中的全部币种先发现 market，再按 oracleId 分组执行。
     */
    public BatchSummary runDiscovered(BigDecimal investment, int outcomeIndex) {
        MarketTargets targets = MarketDiscoveryService.toTargets(discoveryService.discoverConfigured());
        if (targets.isEmpty()) {
            throw new BatchException("未发现任何 market，退出");
        }
        return execute(targets, investment, outcomeIndex, props.getMinOutcomeTokens(), null, null);
    }

    private BatchSummary execute(MarketTargets targets,
                                 BigDecimal investment,
                                 int outcomeIndex,
                                 BigDecimal minOutcomeTokens,
                                 List<String> proxies,
                                 Integer maxWorkers) {
        BuyOrder order = BuyOrder.fromHuman(props.getTokenAddress(), props.getTokenDecimals(),
                investment == null ? props.getInvestment() : investment,
                outcomeIndex,
                minOutcomeTokens);

        List<String> keys = keyLoader.load(Paths.get(props.getPrivateKeysFile()));
        if (keys.isEmpty()) {
            throw new BatchException("未加载到私钥，请检查 " + props.getPrivateKeysFile());
        }
        List<String> proxyList = proxies != null ? proxies : proxyLoader.load(Paths.get(props.getProxiesFile()));
        int width = maxWorkers != null ? maxWorkers : props.getMaxWorkers();

        log.info("Run for markets. markets={} wallets={} workers={}", targets.size(), keys.size(), width);
        return orchestrator.run(keys, proxyList, targets, order, width);
    }
}
