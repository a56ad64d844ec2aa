package com.demo.lending.service.token;

import com.demo.lending.config.LendingProperties;
import com.demo.lending.repository.TokenRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.response.TransactionReceiptProcessor;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class Web3jTokenLedgerTest {

    private static final String CONTRACT = "0x5fbdb2315678afecb367f032d93f642f64180aa3";
    private static final String ALICE = "0x70997970c51812dc3a010c7d01b50e0d17dc79c8";
    private static final String POOL = "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266";

    @Mock
    private Web3j web3j;

    @Mock
    private TransactionManager txManager;

    @Mock
    private TransactionReceiptProcessor receipts;

    private Web3jTokenLedger ledger;

    @BeforeEach
    void setUp() {
        LendingProperties props = new LendingProperties();
        props.setTokens(Map.of("USDT", CONTRACT));
        ledger = new Web3jTokenLedger(web3j, txManager, receipts, new TokenRegistry(props), props);
    }

    private static EthSendTransaction sent(String hash) {
        EthSendTransaction tx = new EthSendTransaction();
        tx.setResult(hash);
        return tx;
    }

    private static TransactionReceipt receipt(String hash, String status) {
        TransactionReceipt receipt = new TransactionReceipt();
        receipt.setTransactionHash(hash);
        receipt.setStatus(status);
        return receipt;
    }

    @Test
    void mintSucceedsOnceReceiptIsOk() throws Exception {
        when(txManager.sendTransaction(any(), any(), eq(CONTRACT), anyString(), eq(BigInteger.ZERO)))
                .thenReturn(sent("0xaa"));
        when(receipts.waitForTransactionReceipt("0xaa")).thenReturn(receipt("0xaa", "0x1"));

        TokenCallResult result = ledger.mint("USDT", ALICE, BigInteger.TEN);

        assertThat(result.success()).isTrue();
    }

    @Test
    void revertedReceiptIsAFailure() throws Exception {
        when(txManager.sendTransaction(any(), any(), eq(CONTRACT), anyString(), eq(BigInteger.ZERO)))
                .thenReturn(sent("0xbb"));
        when(receipts.waitForTransactionReceipt("0xbb")).thenReturn(receipt("0xbb", "0x0"));

        TokenCallResult result = ledger.transferFrom("USDT", ALICE, POOL, BigInteger.TEN);

        assertThat(result.success()).isFalse();
        assertThat(result.reason()).contains("reverted");
    }

    @Test
    void rpcErrorIsAFailureWithoutWaitingForReceipt() throws Exception {
        EthSendTransaction rejected = new EthSendTransaction();
        rejected.setError(new Response.Error(-32000, "insufficient funds for gas"));
        when(txManager.sendTransaction(any(), any(), anyString(), anyString(), any())).thenReturn(rejected);

        TokenCallResult result = ledger.mint("USDT", ALICE, BigInteger.TEN);

        assertThat(result.success()).isFalse();
        assertThat(result.reason()).isEqualTo("insufficient funds for gas");
        verify(receipts, never()).waitForTransactionReceipt(anyString());
    }

    @Test
    void transportExceptionIsAFailure() throws Exception {
        when(txManager.sendTransaction(any(), any(), anyString(), anyString(), any()))
                .thenThrow(new IOException("connection refused"));

        assertThat(ledger.mint("USDT", ALICE, BigInteger.TEN).success()).isFalse();
    }

    @Test
    void unknownTokenNeverReachesTheChain() throws Exception {
        assertThat(ledger.mint("DOGE", ALICE, BigInteger.TEN).reason()).isEqualTo("unknown token DOGE");
        verify(txManager, never()).sendTransaction(any(), any(), anyString(), anyString(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void balanceOfDecodesUint256() throws Exception {
        EthCall call = new EthCall();
        call.setResult("0x" + TypeEncoder.encode(new Uint256(BigInteger.valueOf(42))));
        Request<?, EthCall> request = mock(Request.class);
        when(request.send()).thenReturn(call);
        doReturn(request).when(web3j).ethCall(any(), any());

        assertThat(ledger.balanceOf("USDT", ALICE)).contains(BigInteger.valueOf(42));
    }
}
