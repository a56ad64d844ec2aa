package com.demo.lending.service.token;

import com.demo.lending.config.LendingProperties;
import com.demo.lending.repository.TokenRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * DIP-20 style tokens held in memory: balances, allowances and total supply per token.
 * The pool (custody address) is the spender on every {@code transferFrom}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "lending.token-ledger", name = "mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryTokenLedger implements TokenLedger {

    private final TokenRegistry registry;
    private final String spender;
    private final Map<String, Token> tokens = new HashMap<>();

    public InMemoryTokenLedger(TokenRegistry registry, LendingProperties props) {
        this.registry = registry;
        this.spender = props.getCustodyAddress();
    }

    @Override
    public synchronized TokenCallResult transferFrom(String token, String from, String to, BigInteger amount) {
        Optional<Token> t = token(token);
        if (t.isEmpty()) return TokenCallResult.failed("unknown token " + token);
        Token state = t.get();

        BigInteger allowed = state.allowance(from, spender);
        if (allowed.compareTo(amount) < 0) {
            return TokenCallResult.failed("allowance " + allowed + " below " + amount);
        }
        BigInteger fromBalance = state.balanceOf(from);
        if (fromBalance.compareTo(amount) < 0) {
            return TokenCallResult.failed("balance " + fromBalance + " below " + amount);
        }
        state.balances.put(from, fromBalance.subtract(amount));
        state.balances.merge(to, amount, BigInteger::add);
        state.allowances.put(Token.key(from, spender), allowed.subtract(amount));
        log.debug("{}: transferFrom {} -> {} of {}", token, from, to, amount);
        return TokenCallResult.ok();
    }

    @Override
    public synchronized TokenCallResult mint(String token, String to, BigInteger amount) {
        Optional<Token> t = token(token);
        if (t.isEmpty()) return TokenCallResult.failed("unknown token " + token);
        Token state = t.get();
        state.balances.merge(to, amount, BigInteger::add);
        state.totalSupply = state.totalSupply.add(amount);
        log.debug("{}: minted {} to {}", token, amount, to);
        return TokenCallResult.ok();
    }

    @Override
    public synchronized Optional<BigInteger> balanceOf(String token, String owner) {
        return token(token).map(t -> t.balanceOf(owner));
    }

    /** Owner lets {@code spender} move up to {@code amount}; replaces any previous allowance. */
    public synchronized TokenCallResult approve(String token, String owner, String spender, BigInteger amount) {
        Optional<Token> t = token(token);
        if (t.isEmpty()) return TokenCallResult.failed("unknown token " + token);
        t.get().allowances.put(Token.key(owner, spender), amount);
        return TokenCallResult.ok();
    }

    public synchronized BigInteger allowance(String token, String owner, String spender) {
        return token(token).map(t -> t.allowance(owner, spender)).orElse(BigInteger.ZERO);
    }

    public synchronized BigInteger totalSupply(String token) {
        return token(token).map(t -> t.totalSupply).orElse(BigInteger.ZERO);
    }

    public String spender() {
        return spender;
    }

    private Optional<Token> token(String token) {
        if (!registry.isSupported(token)) {
            return Optional.empty();
        }
        return Optional.of(tokens.computeIfAbsent(token, k -> new Token()));
    }

    private static final class Token {
        private final Map<String, BigInteger> balances = new HashMap<>();
        private final Map<String, BigInteger> allowances = new HashMap<>();
        private BigInteger totalSupply = BigInteger.ZERO;

        static String key(String owner, String spender) {
            return owner + "|" + spender;
        }

        BigInteger balanceOf(String owner) {
            return balances.getOrDefault(owner, BigInteger.ZERO);
        }

        BigInteger allowance(String owner, String spender) {
            return allowances.getOrDefault(key(owner, spender), BigInteger.ZERO);
        }
    }
}
