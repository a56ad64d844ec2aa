package com.demo.lending.service;

import com.demo.lending.config.LendingProperties;
import com.demo.lending.repository.AccountSnapshot;
import com.demo.lending.repository.AccountStore;
import com.demo.lending.repository.MintLogEntry;
import com.demo.lending.repository.MintLogRepository;
import com.demo.lending.repository.TokenRegistry;
import com.demo.lending.service.token.TokenLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Read-only views; everything returned is a copy. */
@Service
@RequiredArgsConstructor
public class PoolQueryService {

    private final AccountStore accounts;
    private final MintLogRepository mintLog;
    private final TokenRegistry tokenRegistry;
    private final TokenLedger tokenLedger;
    private final LendingProperties props;

    public List<String> users() {
        return accounts.users();
    }

    public Optional<String> username(String user) {
        return accounts.username(user);
    }

    public Optional<AccountSnapshot> account(String user) {
        return accounts.snapshot(user);
    }

    public BigInteger totalSupply(String token) {
        return accounts.totalBalance(token);
    }

    public StableTokenView stableToken(String token) {
        Map<String, BigInteger> balances = accounts.balancesOf(token);
        List<StableTokenView.BalanceEntry> entries = balances.entrySet().stream()
                .map(e -> new StableTokenView.BalanceEntry(e.getKey(), e.getValue()))
                .toList();
        BigInteger total = balances.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
        return new StableTokenView(token, total, entries);
    }

    public List<MintLogEntry> mintLog() {
        return mintLog.all();
    }

    public List<MintLogEntry> mintLog(String user) {
        return mintLog.byUser(user);
    }

    public List<String> supportedTokens() {
        return tokenRegistry.supportedTokens();
    }

    public Optional<BigInteger> externalBalance(String token, String owner) {
        return tokenLedger.balanceOf(token, owner);
    }

    public String version() {
        return props.getVersion();
    }

    public record StableTokenView(String token, BigInteger totalSupply, List<BalanceEntry> balances) {
        public record BalanceEntry(String user, BigInteger amount) {}
    }
}
