package com.demo.lending.service;

import java.math.BigInteger;

public interface PriceOracle {

    /** USD value of one unit of the token. */
    BigInteger unitPrice(String token);
}
