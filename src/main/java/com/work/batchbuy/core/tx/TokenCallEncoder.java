package com.work.batchbuy.core.tx;

import com.work.batchbuy.core.exception.ContractCallException;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 最小 ERC20 ABI：approve / allowance / balanceOf。
 */
public final class TokenCallEncoder {

    private TokenCallEncoder() {
    }

    public static String encodeApprove(String spender, BigInteger amount) {
        Function function = new Function(
                "approve",
                Arrays.asList(new Address(spender), new Uint256(amount)),
                Collections.singletonList(new TypeReference<Bool>() {
                })
        );
        return FunctionEncoder.encode(function);
    }

    public static Function allowance(String owner, String spender) {
        return new Function(
                "allowance",
                Arrays.asList(new Address(owner), new Address(spender)),
                Collections.singletonList(new TypeReference<Uint256>() {
                })
        );
    }

    public static Function balanceOf(String owner) {
        return new Function(
                "balanceOf",
                Collections.singletonList(new Address(owner)),
                Collections.singletonList(new TypeReference<Uint256>() {
                })
        );
    }

    /**
     * 解码单个 uint256 返回值；空返回（"0x"，通常是地址上没有合约）视为调用失败。
     */
    public static BigInteger decodeUint256(Function function, String rawValue) {
        if (rawValue == null || rawValue.length() <= 2) {
            throw new ContractCallException(function.getName() + " returned empty data");
        }
        List<Type> decoded = FunctionReturnDecoder.decode(rawValue, function.getOutputParameters());
        if (decoded == null || decoded.isEmpty()) {
            throw new ContractCallException(function.getName() + " returned undecodable data: " + rawValue);
        }
        Object value = decoded.get(0).getValue();
        if (!(value instanceof BigInteger)) {
            throw new ContractCallException(function.getName() + " returned non-uint value: " + value);
        }
        return (BigInteger) value;
    }
}
