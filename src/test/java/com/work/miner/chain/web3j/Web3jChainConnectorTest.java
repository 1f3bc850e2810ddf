package com.work.miner.chain.web3j;

import com.work.miner.chain.TxReceipt;
import com.work.miner.exception.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class Web3jChainConnectorTest {

    private static final String FACTORY = "0x7e384ad1fe06747594a6102ee5b377b273dc1225";
    private static final String TOKEN = "0x7de91b204c1c737bcee6f000aaa6569cf7061cb7";
    private static final String LIABILITY = "0x00000000000000000000000000000000000a11ce";
    private static final String ZERO_TOPIC = Numeric.toHexStringWithPrefixZeroPadded(BigInteger.ZERO, 64);
    private static final String OWNER_TOPIC = Numeric.toHexStringWithPrefixZeroPadded(BigInteger.valueOf(0xa1), 64);

    private Web3j web3j;
    private Web3jChainConnector connector;

    @BeforeEach
    public void setUp() {
        web3j = mock(Web3j.class);
        connector = new Web3jChainConnector(web3j, FACTORY, TOKEN);
    }

    private static Log log(String address, String data, String... topics) {
        Log l = new Log();
        l.setAddress(address);
        l.setData(data);
        l.setTopics(Arrays.asList(topics));
        return l;
    }

    private static String amount(long v) {
        return Numeric.toHexStringWithPrefixZeroPadded(BigInteger.valueOf(v), 64);
    }

    @SuppressWarnings("unchecked")
    private void receipt(TransactionReceipt r) throws IOException {
        EthGetTransactionReceipt resp = new EthGetTransactionReceipt();
        resp.setResult(r);
        Request<?, EthGetTransactionReceipt> req = mock(Request.class);
        when(req.send()).thenReturn(resp);
        doReturn(req).when(web3j).ethGetTransactionReceipt(anyString());
    }

    private static TransactionReceipt baseReceipt() {
        TransactionReceipt r = new TransactionReceipt();
        r.setBlockNumber("0x64");
        r.setBlockHash("0xblock");
        r.setGasUsed("0xc0e08");
        r.setStatus("0x1");
        r.setEffectiveGasPrice("0x3b9aca00");
        return r;
    }

    @Test
    public void create_receipt_exposes_liability_address() throws Exception {
        TransactionReceipt r = baseReceipt();
        r.setLogs(Collections.singletonList(log(FACTORY, "0x",
                Web3jChainConnector.NEW_LIABILITY_TOPIC,
                Numeric.toHexStringWithPrefixZeroPadded(Numeric.toBigInt(LIABILITY), 64))));
        receipt(r);

        TxReceipt tx = connector.getTransactionReceipt("0xabc");

        assertTrue(tx.isSuccess());
        assertEquals(100L, tx.getBlockNumber());
        assertEquals(790_024L, tx.getGasUsed());
        assertEquals(BigInteger.valueOf(1_000_000_000L), tx.getEffectiveGasPrice());
        assertEquals(LIABILITY, tx.getLiabilityAddress());
        assertEquals(BigInteger.ZERO, tx.getMintedAmount());
    }

    @Test
    public void finalize_receipt_sums_token_mints_only() throws Exception {
        TransactionReceipt r = baseReceipt();
        r.setLogs(Arrays.asList(
                log(TOKEN, amount(600), Web3jChainConnector.TRANSFER_TOPIC, ZERO_TOPIC, OWNER_TOPIC),
                log(TOKEN, amount(400), Web3jChainConnector.TRANSFER_TOPIC, ZERO_TOPIC, OWNER_TOPIC),
                // 其他 token 的 Transfer 不计入
                log(FACTORY, amount(999), Web3jChainConnector.TRANSFER_TOPIC, ZERO_TOPIC, OWNER_TOPIC)));
        receipt(r);

        TxReceipt tx = connector.getTransactionReceipt("0xdef");

        assertNull(tx.getLiabilityAddress());
        assertEquals(BigInteger.valueOf(1000), tx.getMintedAmount());
    }

    @Test
    public void missing_receipt_is_null() throws Exception {
        receipt(null);

        assertNull(connector.getTransactionReceipt("0x123"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void rejected_broadcast_raises_transport_error() throws Exception {
        EthSendTransaction resp = new EthSendTransaction();
        resp.setError(new Response.Error(-32000, "nonce too low"));
        Request<?, EthSendTransaction> req = mock(Request.class);
        when(req.send()).thenReturn(resp);
        doReturn(req).when(web3j).ethSendRawTransaction(anyString());

        TransportException e = assertThrows(TransportException.class, () -> connector.sendRawTransaction("0xf8"));
        assertTrue(e.getMessage().contains("nonce too low"));
        assertTrue(e.isRetryable());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void io_failure_on_nonce_read_is_transport_error() throws Exception {
        Request<?, EthGetTransactionCount> req = mock(Request.class);
        when(req.send()).thenThrow(new IOException("connection refused"));
        doReturn(req).when(web3j).ethGetTransactionCount(anyString(), any(DefaultBlockParameter.class));

        assertThrows(TransportException.class, () -> connector.getPendingNonce("0x00000000000000000000000000000000000000a1"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void confirmed_nonce_reads_latest_block() throws Exception {
        EthGetTransactionCount count = new EthGetTransactionCount();
        count.setResult("0x5");
        Request<?, EthGetTransactionCount> req = mock(Request.class);
        when(req.send()).thenReturn(count);
        doReturn(req).when(web3j).ethGetTransactionCount(anyString(), eq(DefaultBlockParameterName.LATEST));

        assertEquals(5L, connector.getConfirmedNonce("0x00000000000000000000000000000000000000a1"));
    }
}
