package com.work.batchbuy.config;

import com.work.batchbuy.chain.ChainClientFactory;
import com.work.batchbuy.chain.web3j.Web3jChainClientFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Web3j 装配：每个账户按自己的代理出口单独建 HTTP RPC 客户端，这里只提供工厂。
 */
@Configuration
public class Web3jConfiguration {

    @Bean
    @ConditionalOnMissingBean(ChainClientFactory.class)
    public ChainClientFactory chainClientFactory(ChainProperties properties) {
        return new Web3jChainClientFactory(properties);
    }
}
