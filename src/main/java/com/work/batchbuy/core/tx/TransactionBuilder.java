package com.work.batchbuy.core.tx;

import com.work.batchbuy.core.model.BuyOrder;

import java.math.BigInteger;

import static com.work.batchbuy.core.support.ValidationUtils.requireAddress;
import static com.work.batchbuy.core.support.ValidationUtils.requireNonNegative;
import static com.work.batchbuy.core.support.ValidationUtils.requireNonNull;

/**
 * 构造 approve / buy 交易意图。纯函数，不访问网络；gasPrice 与 nonce 由调用方传入。
 */
public class TransactionBuilder {

    private final long chainId;
    private final BigInteger gasLimitApprove;
    private final BigInteger gasLimitBuy;

    public TransactionBuilder(long chainId, long gasLimitApprove, long gasLimitBuy) {
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId 必须大于0");
        }
        this.chainId = chainId;
        this.gasLimitApprove = BigInteger.valueOf(requireNonNegative(gasLimitApprove, "gasLimitApprove"));
        this.gasLimitBuy = BigInteger.valueOf(requireNonNegative(gasLimitBuy, "gasLimitBuy"));
    }

    public TransactionIntent buildApprove(String token, String spender, BigInteger amount, long nonce, BigInteger gasPrice) {
        requireAddress(token, "token");
        requireAddress(spender, "spender");
        requireNonNegative(amount, "amount");
        return new TransactionIntent(TransactionIntent.Kind.APPROVE,
                token,
                TokenCallEncoder.encodeApprove(spender, amount),
                BigInteger.valueOf(requireNonNegative(nonce, "nonce")),
                gasLimitApprove,
                requireNonNull(gasPrice, "gasPrice"),
                chainId);
    }

    public TransactionIntent buildBuy(String market, BuyOrder order, long nonce, BigInteger gasPrice) {
        requireAddress(market, "market");
        requireNonNull(order, "order");
        return new TransactionIntent(TransactionIntent.Kind.BUY,
                market,
                MarketCallEncoder.encodeBuy(order.getInvestmentAmount(), order.getOutcomeIndex(), order.getMinOutcomeTokens()),
                BigInteger.valueOf(requireNonNegative(nonce, "nonce")),
                gasLimitBuy,
                requireNonNull(gasPrice, "gasPrice"),
                chainId);
    }
}
