package com.demo.lending.repository;

import com.demo.lending.config.LendingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory multi-token account store guarded by a single ledger lock.
 * <p>
 * Every public method takes the lock; {@link #exclusive(Supplier)} lets callers group
 * a read-validate-mutate sequence into one critical section. The lock is re-entrant, so
 * store methods may be called from inside such a section. Callers must never perform an
 * external call while holding it.
 */
@Slf4j
@Repository
public class AccountStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Account> accounts = new LinkedHashMap<>();
    private final BigInteger defaultCreditScore;

    public AccountStore(LendingProperties props) {
        this.defaultCreditScore = props.getDefaultCreditScore();
    }

    public <T> T exclusive(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean signup(String user, String username) {
        return exclusive(() -> {
            Account existing = accounts.get(user);
            if (existing != null && existing.username() != null) {
                log.info("Signup rejected: user '{}' already exists", user);
                return false;
            }
            if (existing != null) {
                // account opened by an earlier deposit
                existing.setUsername(username);
                log.info("Signup completed existing account: {} -> {}", user, username);
                return true;
            }
            Account account = new Account(defaultCreditScore);
            account.setUsername(username);
            accounts.put(user, account);
            log.info("Signup succeeded: {} -> {}", user, username);
            return true;
        });
    }

    public AccountSnapshot getOrCreate(String user) {
        return exclusive(() -> accounts.computeIfAbsent(user, u -> {
            log.debug("Creating account for '{}' with default credit score {}", u, defaultCreditScore);
            return new Account(defaultCreditScore);
        }).snapshot(user));
    }

    public boolean exists(String user) {
        return exclusive(() -> accounts.containsKey(user));
    }

    public Optional<AccountSnapshot> snapshot(String user) {
        return exclusive(() -> Optional.ofNullable(accounts.get(user)).map(a -> a.snapshot(user)));
    }

    public BigInteger read(String user, String token, LedgerField field) {
        return exclusive(() -> {
            Account account = accounts.get(user);
            return account == null ? BigInteger.ZERO : account.get(field, token);
        });
    }

    /**
     * Applies a signed delta and returns the new value.
     *
     * @throws IllegalStateException if the user is unknown or the result would be negative;
     *                               nothing is mutated in that case
     */
    public BigInteger adjust(String user, String token, LedgerField field, BigInteger delta) {
        return exclusive(() -> {
            Account account = accounts.get(user);
            if (account == null) {
                throw new IllegalStateException("Unknown user: " + user);
            }
            BigInteger next = account.get(field, token).add(delta);
            if (next.signum() < 0) {
                throw new IllegalStateException(
                        field + " of " + token + " for " + user + " would become negative");
            }
            account.set(field, token, next);
            return next;
        });
    }

    public void recordRiskAdvice(String user, String advice) {
        exclusive(() -> {
            Account account = accounts.get(user);
            if (account != null) {
                account.setRiskAdvice(advice);
            }
            return null;
        });
    }

    public List<String> users() {
        return exclusive(() -> new ArrayList<>(accounts.keySet()));
    }

    public Optional<String> username(String user) {
        return exclusive(() -> Optional.ofNullable(accounts.get(user)).map(Account::username));
    }

    /** Non-zero {@code BALANCE} of the token per user, in signup order. */
    public Map<String, BigInteger> balancesOf(String token) {
        return exclusive(() -> {
            Map<String, BigInteger> out = new LinkedHashMap<>();
            accounts.forEach((user, account) -> {
                BigInteger amount = account.get(LedgerField.BALANCE, token);
                if (amount.signum() > 0) {
                    out.put(user, amount);
                }
            });
            return out;
        });
    }

    public BigInteger totalBalance(String token) {
        return balancesOf(token).values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }
}
