package com.demo.lending.service.token;

import com.demo.lending.config.LendingProperties;
import com.demo.lending.repository.TokenRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.response.TransactionReceiptProcessor;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * ERC-20 contracts reached over JSON-RPC. Writes are signed by the pool account and
 * count as successful only once a receipt with status OK is observed.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "lending.token-ledger", name = "mode", havingValue = "web3")
public class Web3jTokenLedger implements TokenLedger {

    private final Web3j web3j;
    private final TransactionManager txManager;
    private final TransactionReceiptProcessor receipts;
    private final TokenRegistry registry;
    private final BigInteger gasPrice;
    private final BigInteger gasLimit;

    public Web3jTokenLedger(Web3j web3j, TransactionManager txManager, TransactionReceiptProcessor receipts,
                            TokenRegistry registry, LendingProperties props) {
        this.web3j = web3j;
        this.txManager = txManager;
        this.receipts = receipts;
        this.registry = registry;
        this.gasPrice = props.getTokenLedger().getGasPrice();
        this.gasLimit = props.getTokenLedger().getGasLimit();
    }

    @Override
    public TokenCallResult transferFrom(String token, String from, String to, BigInteger amount) {
        return submit(token, "transferFrom", () -> new Function("transferFrom",
                List.of(new Address(from), new Address(to), new Uint256(amount)),
                List.of(new TypeReference<Bool>() {})));
    }

    @Override
    public TokenCallResult mint(String token, String to, BigInteger amount) {
        return submit(token, "mint", () -> new Function("mint",
                List.of(new Address(to), new Uint256(amount)),
                Collections.emptyList()));
    }

    @Override
    public Optional<BigInteger> balanceOf(String token, String owner) {
        Optional<String> contract = registry.address(token);
        if (contract.isEmpty()) return Optional.empty();
        try {
            Function fn = new Function("balanceOf",
                    List.of(new Address(owner)),
                    List.of(new TypeReference<Uint256>() {}));
            EthCall call = web3j.ethCall(
                    Transaction.createEthCallTransaction(txManager.getFromAddress(), contract.get(),
                            FunctionEncoder.encode(fn)),
                    DefaultBlockParameterName.LATEST).send();
            if (call.hasError() || call.isReverted()) {
                log.warn("balanceOf {} on {} failed: {}", owner, token,
                        call.hasError() ? call.getError().getMessage() : call.getRevertReason());
                return Optional.empty();
            }
            @SuppressWarnings("rawtypes")
            List<Type> out = FunctionReturnDecoder.decode(call.getValue(), fn.getOutputParameters());
            if (out.isEmpty()) return Optional.empty();
            return Optional.of((BigInteger) out.get(0).getValue());
        } catch (Exception ex) {
            log.warn("balanceOf {} on {} failed: {}", owner, token, ex.toString());
            return Optional.empty();
        }
    }

    private TokenCallResult submit(String token, String method, Supplier<Function> fn) {
        Optional<String> contract = registry.address(token);
        if (contract.isEmpty()) {
            return TokenCallResult.failed("unknown token " + token);
        }
        try {
            String data = FunctionEncoder.encode(fn.get());
            EthSendTransaction sent = txManager.sendTransaction(gasPrice, gasLimit, contract.get(), data, BigInteger.ZERO);
            if (sent.hasError()) {
                return failed(token, method, sent.getError().getMessage());
            }
            TransactionReceipt receipt = receipts.waitForTransactionReceipt(sent.getTransactionHash());
            if (!receipt.isStatusOK()) {
                return failed(token, method, "transaction " + receipt.getTransactionHash() + " reverted");
            }
            log.info("{}.{} confirmed in {}", token, method, receipt.getTransactionHash());
            return TokenCallResult.ok();
        } catch (Exception ex) {
            return failed(token, method, ex.toString());
        }
    }

    private TokenCallResult failed(String token, String method, String reason) {
        log.warn("{}.{} failed: {}", token, method, reason);
        return TokenCallResult.failed(reason);
    }
}
