package com.work.batchbuy.discovery;

import com.work.batchbuy.config.DiscoveryProperties;
import com.work.batchbuy.core.exception.BatchException;
import com.work.batchbuy.core.model.MarketTargets;
import com.work.batchbuy.core.support.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.work.batchbuy.core.support.ValidationUtils.requireNonNull;

/**
 * 并发发现多个币种的 market，结果作为返回值交给调用方，不写任何共享状态。
 */
public class MarketDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(MarketDiscoveryService.class);

    private final MarketDiscoveryClient client;
    private final DiscoveryProperties props;

    public MarketDiscoveryService(MarketDiscoveryClient client, DiscoveryProperties props) {
        this.client = requireNonNull(client, "client");
        this.props = requireNonNull(props, "props");
    }

    public List<DiscoveredMarket> discoverConfigured() {
        return discover(props.getOracles());
    }

    /**
     * @param oracles 币种 -> priceOracleId，结果保持同样顺序
     */
    public List<DiscoveredMarket> discover(Map<String, Integer> oracles) {
        if (oracles == null || oracles.isEmpty()) {
            return Collections.emptyList();
        }
        int threads = Math.max(1, Math.min(props.getParallelism(), oracles.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "market-discovery");
            t.setDaemon(true);
            return t;
        });
        try {
            Map<String, Future<DiscoveredMarket>> futures = new LinkedHashMap<>();
            oracles.forEach((symbol, oracleId) -> futures.put(symbol, pool.submit(() ->
                    new DiscoveredMarket(symbol, oracleId, client.fetchMarketAddress(oracleId).orElse(null)))));

            List<DiscoveredMarket> out = new ArrayList<>(futures.size());
            for (Map.Entry<String, Future<DiscoveredMarket>> e : futures.entrySet()) {
                DiscoveredMarket m = e.getValue().get();
                log.info("Market discovered. symbol={} oracleId={} market={}", m.getSymbol(), m.getOracleId(), m.getAddress());
                out.add(m);
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchException("market discovery interrupted", e);
        } catch (ExecutionException e) {
            throw new BatchException("market discovery failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * 转成 worker 使用的 targets：按 oracleId 分组，地址转 checksum，未发现的币种跳过。
     */
    public static MarketTargets toTargets(List<DiscoveredMarket> markets) {
        Map<Integer, List<String>> groups = new LinkedHashMap<>();
        for (DiscoveredMarket m : markets) {
            if (!m.isFound()) {
                continue;
            }
            List<String> addresses = Addresses.toChecksumList(Collections.singletonList(m.getAddress()));
            if (!addresses.isEmpty()) {
                groups.computeIfAbsent(m.getOracleId(), k -> new ArrayList<>()).addAll(addresses);
            }
        }
        return MarketTargets.of(groups);
    }
}
