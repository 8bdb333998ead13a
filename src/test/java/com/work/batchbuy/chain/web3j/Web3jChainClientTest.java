package com.work.batchbuy.chain.web3j;

import com.work.batchbuy.chain.TransactionReceipt;
import com.work.batchbuy.core.exception.NonceFetchException;
import com.work.batchbuy.core.exception.SubmissionException;
import org.junit.jupiter.api.Test;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class Web3jChainClientTest {

    private static final String ADDR = "0x2c7536E3605D9C16a7a3D7b1898e529396a65c23";

    @Test
    @SuppressWarnings("unchecked")
    public void pending_nonce_io_error_maps_to_nonce_fetch_exception() throws Exception {
        Web3j web3j = mock(Web3j.class);
        Request<?, EthGetTransactionCount> req = mock(Request.class);
        doReturn(req).when(web3j).ethGetTransactionCount(eq(ADDR), eq(DefaultBlockParameterName.PENDING));
        when(req.send()).thenThrow(new IOException("connect timed out"));

        Web3jChainClient client = new Web3jChainClient(web3j, "http://p0:8080");

        NonceFetchException e = assertThrows(NonceFetchException.class, () -> client.getPendingNonce(ADDR));
        assertTrue(e.getMessage().contains("http://p0:8080"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void rpc_error_on_send_maps_to_submission_exception() throws Exception {
        Web3j web3j = mock(Web3j.class);
        Request<?, EthSendTransaction> req = mock(Request.class);
        doReturn(req).when(web3j).ethSendRawTransaction(anyString());
        EthSendTransaction resp = new EthSendTransaction();
        resp.setError(new Response.Error(-32000, "already known"));
        when(req.send()).thenReturn(resp);

        Web3jChainClient client = new Web3jChainClient(web3j, "DIRECT");

        SubmissionException e = assertThrows(SubmissionException.class, () -> client.sendRawTransaction("0xf86b"));
        assertTrue(e.getMessage().contains("already known"));
        assertTrue(e.isRetryable());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void receipt_status_zero_is_failure() throws Exception {
        Web3j web3j = mock(Web3j.class);
        Request<?, EthGetTransactionReceipt> req = mock(Request.class);
        doReturn(req).when(web3j).ethGetTransactionReceipt(eq("0xabc"));
        org.web3j.protocol.core.methods.response.TransactionReceipt raw =
                new org.web3j.protocol.core.methods.response.TransactionReceipt();
        raw.setBlockNumber("0x10");
        raw.setBlockHash("0xb1");
        raw.setStatus("0x0");
        EthGetTransactionReceipt resp = new EthGetTransactionReceipt();
        resp.setResult(raw);
        when(req.send()).thenReturn(resp);

        Optional<TransactionReceipt> r = new Web3jChainClient(web3j, "DIRECT").getTransactionReceipt("0xabc");

        assertTrue(r.isPresent());
        assertFalse(r.get().isSuccess());
        assertEquals(16L, r.get().getBlockNumber());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void missing_receipt_is_empty() throws Exception {
        Web3j web3j = mock(Web3j.class);
        Request<?, EthGetTransactionReceipt> req = mock(Request.class);
        doReturn(req).when(web3j).ethGetTransactionReceipt(eq("0xabc"));
        when(req.send()).thenReturn(new EthGetTransactionReceipt());

        assertFalse(new Web3jChainClient(web3j, "DIRECT").getTransactionReceipt("0xabc").isPresent());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void pending_nonce_is_returned() throws Exception {
        Web3j web3j = mock(Web3j.class);
        Request<?, EthGetTransactionCount> req = mock(Request.class);
        doReturn(req).when(web3j).ethGetTransactionCount(eq(ADDR), eq(DefaultBlockParameterName.PENDING));
        EthGetTransactionCount resp = new EthGetTransactionCount();
        resp.setResult("0x2a");
        when(req.send()).thenReturn(resp);

        assertEquals(42L, new Web3jChainClient(web3j, "DIRECT").getPendingNonce(ADDR));
        verify(req, times(1)).send();
        assertEquals(BigInteger.valueOf(42), resp.getTransactionCount());
    }
}
