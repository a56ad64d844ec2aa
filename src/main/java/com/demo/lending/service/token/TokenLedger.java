package com.demo.lending.service.token;

import java.math.BigInteger;
import java.util.Optional;

/** The authoritative token contracts, one per supported token. */
public interface TokenLedger {

    /** Moves {@code amount} from {@code from} to {@code to}, spending the pool's allowance. */
    TokenCallResult transferFrom(String token, String from, String to, BigInteger amount);

    TokenCallResult mint(String token, String to, BigInteger amount);

    /** Empty when the balance could not be read. */
    Optional<BigInteger> balanceOf(String token, String owner);
}
