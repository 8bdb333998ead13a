package com.work.batchbuy.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.work.batchbuy.config.DiscoveryProperties;
import com.work.batchbuy.core.support.Pacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Optional;

import static com.work.batchbuy.core.support.ValidationUtils.requireNonNull;

/**
 * 按 priceOracleId 查询当前 market 合约地址：
 * GET {baseUrl}/markets/prophet?priceOracleId={id}&frequency={frequency} -> market.address
 */
public class MarketDiscoveryClient {

    private static final Logger log = LoggerFactory.getLogger(MarketDiscoveryClient.class);

    private final RestTemplate restTemplate;
    private final DiscoveryProperties props;
    private final Pacer pacer;

    public MarketDiscoveryClient(RestTemplate restTemplate, DiscoveryProperties props, Pacer pacer) {
        this.restTemplate = requireNonNull(restTemplate, "restTemplate");
        this.props = requireNonNull(props, "props");
        this.pacer = requireNonNull(pacer, "pacer");
    }

    /**
     * 最多尝试 attempts 次，第 n 次失败后等待 n * retryBackoff。全部失败返回 empty。
     */
    public Optional<String> fetchMarketAddress(int oracleId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(props.getBaseUrl())
                .path("/markets/prophet")
                .queryParam("priceOracleId", oracleId)
                .queryParam("frequency", props.getFrequency())
                .build()
                .toUri();
        int attempts = Math.max(1, props.getAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                JsonNode body = restTemplate.getForObject(uri, JsonNode.class);
                String address = body == null ? null : body.path("market").path("address").asText(null);
                if (address == null || address.trim().isEmpty()) {
                    throw new RestClientException("market.address missing in response");
                }
                return Optional.of(address.trim());
            } catch (RestClientException e) {
                if (attempt < attempts) {
                    pacer.pause(props.getRetryBackoff().multipliedBy(attempt));
                } else {
                    log.warn("Market discovery failed. oracleId={} attempts={} err={}", oracleId, attempts, e.getMessage());
                }
            }
        }
        return Optional.empty();
    }
}
