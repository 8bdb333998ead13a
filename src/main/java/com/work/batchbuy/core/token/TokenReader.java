package com.work.batchbuy.core.token;

import com.work.batchbuy.chain.ChainClient;
import com.work.batchbuy.core.tx.TokenCallEncoder;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Function;

import java.math.BigInteger;

import static com.work.batchbuy.core.support.ValidationUtils.requireAddress;
import static com.work.batchbuy.core.support.ValidationUtils.requireNonNull;

/**
 * ERC20 只读查询，绑定一个链客户端与一个 token。
 * 查询失败抛 {@link com.work.batchbuy.core.exception.ContractCallException}。
 */
public class TokenReader {

    private final ChainClient client;
    private final String token;

    public TokenReader(ChainClient client, String token) {
        this.client = requireNonNull(client, "client");
        this.token = requireAddress(token, "token");
    }

    public BigInteger balanceOf(String owner) {
        Function fn = TokenCallEncoder.balanceOf(owner);
        return TokenCallEncoder.decodeUint256(fn, client.call(owner, token, FunctionEncoder.encode(fn)));
    }

    public BigInteger allowance(String owner, String spender) {
        Function fn = TokenCallEncoder.allowance(owner, spender);
        return TokenCallEncoder.decodeUint256(fn, client.call(owner, token, FunctionEncoder.encode(fn)));
    }

    public String getToken() {
        return token;
    }
}
