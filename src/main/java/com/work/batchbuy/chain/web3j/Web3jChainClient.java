package com.work.batchbuy.chain.web3j;

import com.work.batchbuy.chain.ChainClient;
import com.work.batchbuy.chain.TransactionReceipt;
import com.work.batchbuy.core.exception.ConnectivityException;
import com.work.batchbuy.core.exception.ContractCallException;
import com.work.batchbuy.core.exception.NonceFetchException;
import com.work.batchbuy.core.exception.SubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Web3ClientVersion;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Optional;

/**
 * 基于 Web3j 的链客户端实现：
 * - 存活探测 web3_clientVersion
 * - 查询 pending nonce / gasPrice
 * - eth_call 只读调用
 * - eth_sendRawTransaction 广播
 * - eth_getTransactionReceipt 查询回执
 */
public class Web3jChainClient implements ChainClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jChainClient.class);

    private final Web3j web3j;
    private final String label;

    /**
     * @param label 出口描述（代理地址或 DIRECT），只用于日志与异常信息
     */
    public Web3jChainClient(Web3j web3j, String label) {
        this.web3j = web3j;
        this.label = label;
    }

    @Override
    public String clientVersion() {
        try {
            Web3ClientVersion resp = web3j.web3ClientVersion().send();
            if (resp.hasError()) {
                throw new ConnectivityException("web3_clientVersion error (proxy=" + label + "): " + errorOf(resp));
            }
            return resp.getWeb3ClientVersion();
        } catch (IOException e) {
            throw new ConnectivityException("RPC unreachable (proxy=" + label + "): " + e.getMessage(), e);
        }
    }

    @Override
    public long getPendingNonce(String address) {
        try {
            EthGetTransactionCount resp = web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING).send();
            if (resp.hasError()) {
                throw new NonceFetchException("eth_getTransactionCount error: " + errorOf(resp));
            }
            return resp.getTransactionCount().longValueExact();
        } catch (IOException e) {
            throw new NonceFetchException("eth_getTransactionCount failed (proxy=" + label + "): " + e.getMessage(), e);
        }
    }

    @Override
    public BigInteger getGasPrice() {
        try {
            EthGasPrice resp = web3j.ethGasPrice().send();
            if (resp.hasError()) {
                throw new ContractCallException("eth_gasPrice error: " + errorOf(resp));
            }
            return resp.getGasPrice();
        } catch (IOException e) {
            throw new ContractCallException("eth_gasPrice failed (proxy=" + label + "): " + e.getMessage(), e);
        }
    }

    @Override
    public String call(String from, String to, String data) {
        try {
            Transaction tx = Transaction.createEthCallTransaction(from, to, data);
            EthCall resp = web3j.ethCall(tx, DefaultBlockParameterName.LATEST).send();
            if (resp.hasError()) {
                throw new ContractCallException("eth_call error to=" + to + ": " + errorOf(resp));
            }
            if (resp.isReverted()) {
                throw new ContractCallException("eth_call reverted to=" + to + ": " + resp.getRevertReason());
            }
            return resp.getValue();
        } catch (IOException e) {
            throw new ContractCallException("eth_call failed to=" + to + " (proxy=" + label + "): " + e.getMessage(), e);
        }
    }

    @Override
    public String sendRawTransaction(String signedHex) {
        try {
            EthSendTransaction resp = web3j.ethSendRawTransaction(signedHex).send();
            if (resp.hasError()) {
                throw new SubmissionException("eth_sendRawTransaction error: " + errorOf(resp));
            }
            return resp.getTransactionHash();
        } catch (IOException e) {
            throw new SubmissionException("eth_sendRawTransaction failed (proxy=" + label + "): " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<TransactionReceipt> getTransactionReceipt(String txHash) {
        try {
            EthGetTransactionReceipt resp = web3j.ethGetTransactionReceipt(txHash).send();
            if (resp.hasError()) {
                throw new ContractCallException("eth_getTransactionReceipt error: " + errorOf(resp));
            }
            Optional<org.web3j.protocol.core.methods.response.TransactionReceipt> receiptOpt = resp.getTransactionReceipt();
            if (!receiptOpt.isPresent()) {
                return Optional.empty();
            }
            org.web3j.protocol.core.methods.response.TransactionReceipt r = receiptOpt.get();
            BigInteger bn = r.getBlockNumber();
            return Optional.of(new TransactionReceipt(txHash, bn == null ? -1L : bn.longValue(), isReceiptSuccess(r)));
        } catch (IOException e) {
            log.debug("Web3j getTransactionReceipt failed. txHash={} err={}", txHash, e.getMessage());
            throw new ContractCallException("eth_getTransactionReceipt failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        web3j.shutdown();
    }

    private boolean isReceiptSuccess(org.web3j.protocol.core.methods.response.TransactionReceipt receipt) {
        // EVM receipt status: 0x1 success, 0x0 failure；没有 status 字段的链按成功处理
        String status = receipt.getStatus();
        if (status == null) {
            return true;
        }
        return !"0x0".equalsIgnoreCase(status);
    }

    private static String errorOf(Response<?> resp) {
        Response.Error err = resp.getError();
        return err == null ? "unknown" : err.getCode() + " " + err.getMessage();
    }
}
