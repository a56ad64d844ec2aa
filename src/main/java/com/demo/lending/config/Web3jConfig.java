package com.demo.lending.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;

@Configuration
@ConditionalOnProperty(prefix = "lending.token-ledger", name = "mode", havingValue = "web3")
public class Web3jConfig {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(LendingProperties props) {
        return Web3j.build(new HttpService(props.getTokenLedger().getRpcUrl()));
    }

    /** Signs as the pool: spender for transferFrom, minter for mint. */
    @Bean
    public TransactionManager poolTransactionManager(Web3j web3j, LendingProperties props) {
        String key = props.getTokenLedger().getPrivateKey();
        if (!StringUtils.hasText(key)) {
            throw new IllegalStateException("lending.token-ledger.private-key is required in web3 mode");
        }
        return new RawTransactionManager(web3j, Credentials.create(key), props.getTokenLedger().getChainId());
    }

    @Bean
    public TransactionReceiptProcessor receiptProcessor(Web3j web3j, LendingProperties props) {
        return new PollingTransactionReceiptProcessor(web3j,
                props.getTokenLedger().getReceiptPollMs(),
                props.getTokenLedger().getReceiptPollAttempts());
    }
}
