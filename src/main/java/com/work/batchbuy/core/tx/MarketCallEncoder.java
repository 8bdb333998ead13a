package com.work.batchbuy.core.tx;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * market 合约只用到 buy(uint256 investmentAmount, uint256 outcomeIndex, uint256 minOutcomeTokensToBuy)。
 */
public final class MarketCallEncoder {

    private MarketCallEncoder() {
    }

    public static String encodeBuy(BigInteger investmentAmount, BigInteger outcomeIndex, BigInteger minOutcomeTokensToBuy) {
        Function function = new Function(
                "buy",
                Arrays.asList(
                        new Uint256(investmentAmount),
                        new Uint256(outcomeIndex),
                        new Uint256(minOutcomeTokensToBuy)
                ),
                Collections.emptyList()
        );
        return FunctionEncoder.encode(function);
    }
}
