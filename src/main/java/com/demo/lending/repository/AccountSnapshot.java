package com.demo.lending.repository;

import java.math.BigInteger;
import java.util.Map;

/**
 * Immutable copy of an account taken under the ledger lock.
 * Missing tokens read as zero.
 */
public record AccountSnapshot(
        String user,
        String username,
        Map<String, BigInteger> balances,
        Map<String, BigInteger> collateral,
        Map<String, BigInteger> borrowed,
        Map<String, BigInteger> deposited,
        BigInteger creditScore,
        String riskAdvice
) {

    public BigInteger balance(String token) {
        return balances.getOrDefault(token, BigInteger.ZERO);
    }

    public BigInteger collateral(String token) {
        return collateral.getOrDefault(token, BigInteger.ZERO);
    }

    public BigInteger borrowed(String token) {
        return borrowed.getOrDefault(token, BigInteger.ZERO);
    }

    public BigInteger deposited(String token) {
        return deposited.getOrDefault(token, BigInteger.ZERO);
    }
}
