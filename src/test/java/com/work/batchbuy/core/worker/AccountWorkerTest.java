package com.work.batchbuy.core.worker;

import com.work.batchbuy.chain.ChainClient;
import com.work.batchbuy.chain.ChainClientFactory;
import com.work.batchbuy.chain.TransactionReceipt;
import com.work.batchbuy.config.BatchProperties;
import com.work.batchbuy.core.exception.ConnectivityException;
import com.work.batchbuy.core.exception.ContractCallException;
import com.work.batchbuy.core.exception.NonceFetchException;
import com.work.batchbuy.core.exception.SubmissionException;
import com.work.batchbuy.core.metrics.NoopBatchMetrics;
import com.work.batchbuy.core.model.BuyOrder;
import com.work.batchbuy.core.model.MarketTargets;
import com.work.batchbuy.core.model.NonceAdvancePolicy;
import com.work.batchbuy.core.model.WorkerResult;
import com.work.batchbuy.core.model.WorkerState;
import com.work.batchbuy.core.submission.SubmissionPipeline;
import com.work.batchbuy.core.support.Pacer;
import com.work.batchbuy.core.token.AllowanceOracle;
import com.work.batchbuy.core.tx.TransactionBuilder;
import com.work.batchbuy.core.tx.TransactionSigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionDecoder;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

public class AccountWorkerTest {

    private static final String KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    private static final String TOKEN = "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913";
    private static final String MARKET_1 = "0x1111111111111111111111111111111111111111";
    private static final String MARKET_2 = "0x2222222222222222222222222222222222222222";

    private static final String BALANCE_OF = "0x70a08231";
    private static final String ALLOWANCE = "0xdd62ed3e";

    private BatchProperties props;
    private ChainClient client;
    private ChainClientFactory factory;
    private BuyOrder order;
    private final List<List<Duration>> pauses = new ArrayList<>();
    private final Pacer pacer = (base, jitter) -> pauses.add(Arrays.asList(base, jitter));

    @BeforeEach
    public void setUp() {
        props = new BatchProperties();
        props.setTokenAddress(TOKEN);

        client = mock(ChainClient.class);
        factory = mock(ChainClientFactory.class);
        when(factory.create(any())).thenReturn(client);

        when(client.getPendingNonce(anyString())).thenReturn(5L);
        when(client.getGasPrice()).thenReturn(BigInteger.valueOf(1_000_000_000L));
        when(client.sendRawTransaction(anyString())).thenAnswer(inv -> Hash.sha3((String) inv.getArgument(0)));
        when(client.getTransactionReceipt(anyString())).thenAnswer(inv ->
                Optional.of(new TransactionReceipt(inv.getArgument(0), 100L, true)));
        stubBalance(BigInteger.valueOf(1_000_000L));
        stubAllowance(BigInteger.ZERO);

        order = BuyOrder.fromHuman(TOKEN, 6, new BigDecimal("0.1"), 0, BigDecimal.ZERO);
    }

    @Test
    public void fresh_account_approves_then_buys() {
        props.setCheckAllowance(false);

        WorkerResult r = worker(MarketTargets.single(Collections.singletonList(MARKET_1))).call();

        assertEquals(Credentials.create(KEY).getAddress(), r.getAddress());
        assertEquals(WorkerState.DONE, r.getState());
        assertEquals(1, r.getApprovalsSent());
        assertEquals(1, r.getBuysSent());
        assertEquals(0, r.getApprovalsSkipped());

        List<RawTransaction> sent = sentTransactions(2);
        assertTrue(TOKEN.equalsIgnoreCase(sent.get(0).getTo()));
        assertTrue(MARKET_1.equalsIgnoreCase(sent.get(1).getTo()));
        assertEquals(BigInteger.valueOf(5), sent.get(0).getNonce());
        assertEquals(BigInteger.valueOf(6), sent.get(1).getNonce());
        verify(client, never()).call(anyString(), anyString(), startsWith(ALLOWANCE));
        verify(client, times(1)).close();
    }

    @Test
    public void sufficient_allowance_skips_approve() {
        stubAllowance(AllowanceOracle.MAX_UINT256);

        WorkerResult r = worker(MarketTargets.single(Collections.singletonList(MARKET_1))).call();

        assertEquals(0, r.getApprovalsSent());
        assertEquals(1, r.getBuysSent());
        assertEquals(1, r.getApprovalsSkipped());
        List<RawTransaction> sent = sentTransactions(1);
        assertTrue(MARKET_1.equalsIgnoreCase(sent.get(0).getTo()));
        assertEquals(BigInteger.valueOf(5), sent.get(0).getNonce());
    }

    @Test
    public void nonces_strictly_increase_across_targets() {
        WorkerResult r = worker(MarketTargets.single(Arrays.asList(MARKET_1, MARKET_2))).call();

        assertEquals(2, r.getApprovalsSent());
        assertEquals(2, r.getBuysSent());
        List<RawTransaction> sent = sentTransactions(4);
        for (int i = 0; i < sent.size(); i++) {
            assertEquals(BigInteger.valueOf(5 + i), sent.get(i).getNonce());
        }
    }

    @Test
    public void insufficient_balance_skips_target() {
        stubBalance(BigInteger.valueOf(99_999L));

        WorkerResult r = worker(MarketTargets.single(Collections.singletonList(MARKET_1))).call();

        assertEquals(WorkerState.DONE, r.getState());
        assertEquals(0, r.getApprovalsSent());
        assertEquals(0, r.getBuysSent());
        verify(client, never()).sendRawTransaction(anyString());
    }

    @Test
    public void balance_query_error_skips_only_that_target() {
        when(client.call(anyString(), anyString(), startsWith(BALANCE_OF)))
                .thenThrow(new ContractCallException("eth_call failed"))
                .thenReturn(uint(BigInteger.valueOf(1_000_000L)));

        WorkerResult r = worker(MarketTargets.single(Arrays.asList(MARKET_1, MARKET_2))).call();

        assertEquals(1, r.getApprovalsSent());
        assertEquals(1, r.getBuysSent());
        List<RawTransaction> sent = sentTransactions(2);
        assertTrue(MARKET_2.equalsIgnoreCase(sent.get(1).getTo()));
    }

    @Test
    public void exhausted_sends_do_not_advance_nonce() {
        when(client.sendRawTransaction(anyString())).thenThrow(new SubmissionException("connection reset"));

        WorkerResult r = worker(MarketTargets.single(Collections.singletonList(MARKET_1))).call();

        assertEquals(WorkerState.DONE, r.getState());
        assertEquals(0, r.getApprovalsSent());
        assertEquals(0, r.getBuysSent());
        // approve 2 次 + buy 2 次，全部复用 nonce 5
        List<RawTransaction> sent = sentTransactions(4);
        for (RawTransaction tx : sent) {
            assertEquals(BigInteger.valueOf(5), tx.getNonce());
        }
    }

    @Test
    public void unconfirmed_approve_still_attempts_buy_with_same_nonce() {
        when(client.getTransactionReceipt(anyString())).thenReturn(Optional.empty());

        WorkerResult r = worker(MarketTargets.single(Collections.singletonList(MARKET_1))).call();

        assertEquals(0, r.getApprovalsSent());
        assertEquals(1, r.getBuysSent());
        List<RawTransaction> sent = sentTransactions(2);
        assertEquals(BigInteger.valueOf(5), sent.get(0).getNonce());
        assertEquals(BigInteger.valueOf(5), sent.get(1).getNonce());
    }

    @Test
    public void sent_policy_advances_nonce_before_receipt() {
        props.setApproveNonceAdvance(NonceAdvancePolicy.SENT);
        when(client.getTransactionReceipt(anyString())).thenReturn(Optional.empty());

        WorkerResult r = worker(MarketTargets.single(Collections.singletonList(MARKET_1))).call();

        assertEquals(0, r.getApprovalsSent());
        List<RawTransaction> sent = sentTransactions(2);
        assertEquals(BigInteger.valueOf(5), sent.get(0).getNonce());
        assertEquals(BigInteger.valueOf(6), sent.get(1).getNonce());
    }

    @Test
    public void reverted_approve_consumes_nonce_under_default_policy() {
        when(client.getTransactionReceipt(anyString())).thenAnswer(inv ->
                Optional.of(new TransactionReceipt(inv.getArgument(0), 100L, false)));
        props.setCheckAllowance(false);

        WorkerResult r = worker(MarketTargets.single(Arrays.asList(MARKET_1, MARKET_2))).call();

        assertEquals(NonceAdvancePolicy.INCLUDED, new BatchProperties().getApproveNonceAdvance());
        assertEquals(0, r.getApprovalsSent());
        assertEquals(2, r.getBuysSent());
        List<RawTransaction> sent = sentTransactions(4);
        for (int i = 0; i < sent.size(); i++) {
            assertEquals(BigInteger.valueOf(5 + i), sent.get(i).getNonce());
        }
    }

    @Test
    public void reverted_approve_keeps_nonce_under_confirmed_policy() {
        when(client.getTransactionReceipt(anyString())).thenAnswer(inv ->
                Optional.of(new TransactionReceipt(inv.getArgument(0), 100L, false)));
        props.setApproveNonceAdvance(NonceAdvancePolicy.CONFIRMED);

        WorkerResult r = worker(MarketTargets.single(Collections.singletonList(MARKET_1))).call();

        assertEquals(1, r.getBuysSent());
        List<RawTransaction> sent = sentTransactions(2);
        assertEquals(BigInteger.valueOf(5), sent.get(1).getNonce());
    }

    @Test
    public void nonce_fetch_failure_marks_failed() {
        when(client.getPendingNonce(anyString())).thenThrow(new NonceFetchException("timeout"));

        AccountWorker w = worker(MarketTargets.single(Collections.singletonList(MARKET_1)));
        WorkerResult r = w.call();

        assertEquals(WorkerState.FAILED, r.getState());
        assertEquals(WorkerState.FAILED, w.getState());
        assertEquals(0, r.getBuysSent());
        verify(client, never()).sendRawTransaction(anyString());
        verify(client, times(1)).close();
    }

    @Test
    public void connectivity_failure_marks_failed() {
        when(factory.create(any())).thenThrow(new ConnectivityException("RPC unreachable"));

        WorkerResult r = worker(MarketTargets.single(Collections.singletonList(MARKET_1))).call();

        assertEquals(WorkerState.FAILED, r.getState());
        assertEquals("RPC unreachable", r.getFailureReason());
    }

    @Test
    public void invalid_market_is_skipped() {
        WorkerResult r = worker(MarketTargets.single(Arrays.asList("not-an-address", MARKET_1))).call();

        assertEquals(1, r.getBuysSent());
        sentTransactions(2);
    }

    @Test
    public void buy_only_mode_sends_no_approve() {
        props.setApproveEnabled(false);

        WorkerResult r = worker(MarketTargets.single(Collections.singletonList(MARKET_1))).call();

        assertEquals(0, r.getApprovalsSent());
        assertEquals(1, r.getBuysSent());
        verify(client, never()).call(anyString(), anyString(), startsWith(ALLOWANCE));
    }

    @Test
    public void buy_is_not_awaited() {
        props.setApproveEnabled(false);

        WorkerResult r = worker(MarketTargets.single(Arrays.asList(MARKET_1, MARKET_2))).call();

        assertEquals(2, r.getBuysSent());
        verify(client, never()).getTransactionReceipt(anyString());
    }

    @Test
    public void think_time_follows_each_sent_buy() {
        props.setThinkTime(Duration.ofMillis(777));
        props.setThinkJitter(Duration.ofMillis(333));

        WorkerResult r = worker(MarketTargets.single(Arrays.asList(MARKET_1, MARKET_2))).call();

        assertEquals(2, r.getBuysSent());
        assertEquals(2, thinkPauses());
    }

    @Test
    public void failed_buy_gets_failure_pause_not_think_time() {
        props.setApproveEnabled(false);
        props.setThinkTime(Duration.ofMillis(777));
        props.setThinkJitter(Duration.ofMillis(333));
        props.setFailurePause(Duration.ofMillis(555));
        when(client.sendRawTransaction(anyString())).thenThrow(new SubmissionException("429 Too Many Requests"));

        WorkerResult r = worker(MarketTargets.single(Collections.singletonList(MARKET_1))).call();

        assertEquals(0, r.getBuysSent());
        assertEquals(0, thinkPauses());
        assertTrue(pauses.contains(Arrays.asList(Duration.ofMillis(555), Duration.ZERO)));
    }

    @Test
    public void approve_only_mode_sends_no_buy() {
        props.setBuyEnabled(false);
        props.setCheckAllowance(false);

        WorkerResult r = worker(MarketTargets.single(Collections.singletonList(MARKET_1))).call();

        assertEquals(1, r.getApprovalsSent());
        assertEquals(0, r.getBuysSent());
        List<RawTransaction> sent = sentTransactions(1);
        assertTrue(TOKEN.equalsIgnoreCase(sent.get(0).getTo()));
        assertEquals(0, thinkPauses());
    }

    private long thinkPauses() {
        List<Duration> think = Arrays.asList(props.getThinkTime(), props.getThinkJitter());
        return pauses.stream().filter(think::equals).count();
    }

    private AccountWorker worker(MarketTargets targets) {
        NoopBatchMetrics metrics = new NoopBatchMetrics();
        SubmissionPipeline pipeline = new SubmissionPipeline(props, pacer, metrics);
        TransactionBuilder builder = new TransactionBuilder(8453L, props.getGasLimitApprove(), props.getGasLimitBuy());
        return new AccountWorker(KEY, null, targets, order, factory, pipeline, builder, new TransactionSigner(),
                props, pacer, metrics, "https://basescan.org/tx/");
    }

    private void stubBalance(BigInteger balance) {
        when(client.call(anyString(), anyString(), startsWith(BALANCE_OF))).thenReturn(uint(balance));
    }

    private void stubAllowance(BigInteger allowance) {
        when(client.call(anyString(), anyString(), startsWith(ALLOWANCE))).thenReturn(uint(allowance));
    }

    private List<RawTransaction> sentTransactions(int expected) {
        ArgumentCaptor<String> raw = ArgumentCaptor.forClass(String.class);
        verify(client, times(expected)).sendRawTransaction(raw.capture());
        List<RawTransaction> out = new ArrayList<>();
        for (String hex : raw.getAllValues()) {
            out.add(TransactionDecoder.decode(hex));
        }
        return out;
    }

    private static String uint(BigInteger value) {
        return Numeric.toHexStringWithPrefixZeroPadded(value, 64);
    }
}
