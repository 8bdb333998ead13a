package com.work.batchbuy.core.submission;

import com.work.batchbuy.chain.ChainClient;
import com.work.batchbuy.chain.TransactionReceipt;
import com.work.batchbuy.config.BatchProperties;
import com.work.batchbuy.core.exception.ContractCallException;
import com.work.batchbuy.core.exception.SubmissionException;
import com.work.batchbuy.core.metrics.BatchMetrics;
import com.work.batchbuy.core.model.Account;
import com.work.batchbuy.core.support.Pacer;
import com.work.batchbuy.core.tx.SignedPayload;
import com.work.batchbuy.core.tx.TransactionBuilder;
import com.work.batchbuy.core.tx.TransactionSigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class SubmissionPipelineTest {

    private static final String KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    private static final String TOKEN = "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913";
    private static final String SPENDER = "0x1111111111111111111111111111111111111111";

    private final List<Duration> pauses = new ArrayList<>();
    private final Pacer recordingPacer = (base, jitter) -> pauses.add(base);

    private BatchProperties props;
    private BatchMetrics metrics;
    private ChainClient client;
    private SignedPayload payload;

    @BeforeEach
    public void setUp() {
        props = new BatchProperties();
        props.setSendRetries(3);
        props.setRetryBackoff(Duration.ofSeconds(5));
        props.setRetryJitter(Duration.ofSeconds(1));
        metrics = mock(BatchMetrics.class);
        client = mock(ChainClient.class);

        TransactionBuilder builder = new TransactionBuilder(8453L, 120_000L, 250_000L);
        payload = new TransactionSigner().sign(
                builder.buildApprove(TOKEN, SPENDER, BigInteger.TEN, 7L, BigInteger.ONE),
                Account.fromPrivateKey(KEY));
    }

    @Test
    public void first_attempt_success_does_not_pause() {
        when(client.sendRawTransaction(anyString())).thenReturn("0xabc");

        SubmissionResult r = pipeline().sendWithRetry(client, payload);

        assertTrue(r.isSent());
        assertEquals("0xabc", r.getTxHash());
        assertEquals(1, r.getAttempts());
        assertTrue(pauses.isEmpty());
        verify(metrics).submission(eq("approve"), eq("sent"));
    }

    @Test
    public void retries_with_linear_backoff_and_no_pause_after_last_attempt() {
        when(client.sendRawTransaction(anyString())).thenThrow(new SubmissionException("503 Service Unavailable"));

        SubmissionResult r = pipeline().sendWithRetry(client, payload);

        assertFalse(r.isSent());
        assertEquals(SubmissionResult.Status.SEND_FAILED, r.getStatus());
        assertEquals(3, r.getAttempts());
        assertEquals("503 Service Unavailable", r.getError());
        verify(client, times(3)).sendRawTransaction(eq(payload.getRawHex()));
        assertEquals(Arrays.asList(Duration.ofSeconds(5), Duration.ofSeconds(10)), pauses);
        verify(metrics).submission(eq("approve"), eq("failed"));
    }

    @Test
    public void recovers_on_second_attempt_with_same_payload() {
        when(client.sendRawTransaction(anyString()))
                .thenThrow(new SubmissionException("timeout"))
                .thenReturn("0xdef");

        SubmissionResult r = pipeline().sendWithRetry(client, payload);

        assertTrue(r.isSent());
        assertEquals(2, r.getAttempts());
        verify(client, times(2)).sendRawTransaction(eq(payload.getRawHex()));
        assertEquals(1, pauses.size());
    }

    @Test
    public void already_known_counts_as_sent_with_local_hash() {
        when(client.sendRawTransaction(anyString()))
                .thenThrow(new SubmissionException("timeout"))
                .thenThrow(new SubmissionException("eth_sendRawTransaction error: -32000 already known"));

        SubmissionResult r = pipeline().sendWithRetry(client, payload);

        assertTrue(r.isSent());
        assertEquals(payload.getTxHash(), r.getTxHash());
        verify(metrics).submission(eq("approve"), eq("already_known"));
    }

    @Test
    public void inclusion_returns_confirmed_on_success_receipt() {
        when(client.getTransactionReceipt(eq("0xabc")))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(new TransactionReceipt("0xabc", 12L, true)));

        SubmissionResult r = pipeline().awaitInclusion(client, "0xabc", Duration.ofSeconds(5), Duration.ofSeconds(3));

        assertEquals(SubmissionResult.Status.CONFIRMED, r.getStatus());
        assertTrue(r.isIncluded());
        assertEquals(12L, r.getReceipt().getBlockNumber());
        assertEquals(Arrays.asList(Duration.ofSeconds(3)), pauses);
    }

    @Test
    public void inclusion_returns_reverted_on_failed_receipt() {
        when(client.getTransactionReceipt(eq("0xabc")))
                .thenReturn(Optional.of(new TransactionReceipt("0xabc", 12L, false)));

        SubmissionResult r = pipeline().awaitInclusion(client, "0xabc", Duration.ofSeconds(5), Duration.ofSeconds(3));

        assertEquals(SubmissionResult.Status.REVERTED, r.getStatus());
        assertTrue(r.isIncluded());
        assertTrue(pauses.isEmpty());
    }

    @Test
    public void inclusion_times_out_as_unconfirmed_with_last_poll_at_deadline() {
        when(client.getTransactionReceipt(eq("0xabc"))).thenReturn(Optional.empty());

        SubmissionResult r = pipeline().awaitInclusion(client, "0xabc", Duration.ofSeconds(5), Duration.ofSeconds(3));

        assertEquals(SubmissionResult.Status.UNCONFIRMED, r.getStatus());
        assertFalse(r.isIncluded());
        assertEquals("0xabc", r.getTxHash());
        // 查询时刻 0s / 3s / 5s
        verify(client, times(3)).getTransactionReceipt(eq("0xabc"));
        assertEquals(Arrays.asList(Duration.ofSeconds(3), Duration.ofSeconds(2)), pauses);
        verify(metrics).receiptWait(eq("unconfirmed"));
    }

    @Test
    public void receipt_query_errors_are_treated_as_not_found() {
        when(client.getTransactionReceipt(eq("0xabc")))
                .thenThrow(new ContractCallException("502 Bad Gateway"))
                .thenReturn(Optional.of(new TransactionReceipt("0xabc", 3L, true)));

        SubmissionResult r = pipeline().awaitInclusion(client, "0xabc", Duration.ofSeconds(5), Duration.ofSeconds(3));

        assertEquals(SubmissionResult.Status.CONFIRMED, r.getStatus());
    }

    @Test
    public void rejects_zero_retries() {
        props.setSendRetries(0);
        assertThrows(IllegalArgumentException.class, this::pipeline);
    }

    private SubmissionPipeline pipeline() {
        return new SubmissionPipeline(props, recordingPacer, metrics);
    }
}
