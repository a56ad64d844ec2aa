package com.demo.lending.repository;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/** Live account state; only {@link AccountStore} touches it, and only under its lock. */
class Account {

    private final Map<String, BigInteger> balances = new HashMap<>();
    private final Map<String, BigInteger> collateral = new HashMap<>();
    private final Map<String, BigInteger> borrowed = new HashMap<>();
    private final Map<String, BigInteger> deposited = new HashMap<>();
    private final BigInteger creditScore;
    private String riskAdvice;
    private String username;

    Account(BigInteger creditScore) {
        this.creditScore = creditScore;
    }

    Map<String, BigInteger> positions(LedgerField field) {
        return switch (field) {
            case BALANCE -> balances;
            case COLLATERAL -> collateral;
            case BORROWED -> borrowed;
            case DEPOSITED -> deposited;
        };
    }

    BigInteger get(LedgerField field, String token) {
        return positions(field).getOrDefault(token, BigInteger.ZERO);
    }

    void set(LedgerField field, String token, BigInteger value) {
        positions(field).put(token, value);
    }

    void setRiskAdvice(String riskAdvice) {
        this.riskAdvice = riskAdvice;
    }

    void setUsername(String username) {
        this.username = username;
    }

    String username() {
        return username;
    }

    AccountSnapshot snapshot(String user) {
        return new AccountSnapshot(user, username,
                Map.copyOf(balances), Map.copyOf(collateral), Map.copyOf(borrowed), Map.copyOf(deposited),
                creditScore, riskAdvice);
    }
}
