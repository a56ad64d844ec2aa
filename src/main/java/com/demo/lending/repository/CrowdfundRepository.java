package com.demo.lending.repository;

import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/** Contribution pool kept apart from the account store, with its own lock. */
@Repository
public class CrowdfundRepository {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, BigInteger> funds = new LinkedHashMap<>();
    private final Map<String, Map<String, BigInteger>> contributors = new LinkedHashMap<>();

    /** Adds to both the token total and the contributor's share in one step; returns the new total. */
    public BigInteger contribute(String user, String token, BigInteger amount) {
        lock.lock();
        try {
            BigInteger total = funds.getOrDefault(token, BigInteger.ZERO).add(amount);
            funds.put(token, total);
            contributors.computeIfAbsent(user, u -> new LinkedHashMap<>())
                    .merge(token, amount, BigInteger::add);
            return total;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, BigInteger> funds() {
        lock.lock();
        try {
            return new LinkedHashMap<>(funds);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, BigInteger> contributions(String user) {
        lock.lock();
        try {
            return new LinkedHashMap<>(contributors.getOrDefault(user, Map.of()));
        } finally {
            lock.unlock();
        }
    }
}
