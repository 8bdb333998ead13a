package com.work.batchbuy.core.model;

import com.work.batchbuy.core.support.TokenAmounts;

import java.math.BigDecimal;
import java.math.BigInteger;

import static com.work.batchbuy.core.support.ValidationUtils.requireAddress;
import static com.work.batchbuy.core.support.ValidationUtils.requireNonNegative;

/**
 * buy 参数（最小单位），所有 worker 共享的只读值。
 */
public final class BuyOrder {

    private final String tokenAddress;
    private final int tokenDecimals;
    private final BigInteger investmentAmount;
    private final BigInteger outcomeIndex;
    private final BigInteger minOutcomeTokens;

    public BuyOrder(String tokenAddress,
                    int tokenDecimals,
                    BigInteger investmentAmount,
                    int outcomeIndex,
                    BigInteger minOutcomeTokens) {
        this.tokenAddress = requireAddress(tokenAddress, "tokenAddress");
        this.tokenDecimals = (int) requireNonNegative(tokenDecimals, "tokenDecimals");
        this.investmentAmount = requireNonNegative(investmentAmount, "investmentAmount");
        this.outcomeIndex = BigInteger.valueOf(requireNonNegative(outcomeIndex, "outcomeIndex"));
        this.minOutcomeTokens = requireNonNegative(minOutcomeTokens, "minOutcomeTokens");
    }

    /**
     * 由人类可读金额构造，按 token 精度换算成最小单位。
     */
    public static BuyOrder fromHuman(String tokenAddress,
                                     int tokenDecimals,
                                     BigDecimal investment,
                                     int outcomeIndex,
                                     BigDecimal minOutcomeTokens) {
        return new BuyOrder(tokenAddress,
                tokenDecimals,
                TokenAmounts.toSmallestUnit(investment, tokenDecimals),
                outcomeIndex,
                TokenAmounts.toSmallestUnit(minOutcomeTokens == null ? BigDecimal.ZERO : minOutcomeTokens, tokenDecimals));
    }

    public String getTokenAddress() {
        return tokenAddress;
    }

    public int getTokenDecimals() {
        return tokenDecimals;
    }

    public BigInteger getInvestmentAmount() {
        return investmentAmount;
    }

    public BigInteger getOutcomeIndex() {
        return outcomeIndex;
    }

    public BigInteger getMinOutcomeTokens() {
        return minOutcomeTokens;
    }

    @Override
    public String toString() {
        return "BuyOrder{" +
                "token=" + tokenAddress +
                ", investmentAmount=" + investmentAmount +
                ", decimals=" + tokenDecimals +
                ", outcomeIndex=" + outcomeIndex +
                ", minOutcomeTokens=" + minOutcomeTokens +
                '}';
    }
}
