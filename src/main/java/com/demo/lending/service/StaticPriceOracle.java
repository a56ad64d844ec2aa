package com.demo.lending.service;

import com.demo.lending.config.LendingProperties;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;

/** Fixed price table from configuration; unlisted tokens are worth 1 USD per unit. */
@Component
public class StaticPriceOracle implements PriceOracle {

    private final Map<String, BigInteger> prices;

    public StaticPriceOracle(LendingProperties props) {
        this.prices = Map.copyOf(props.getPrices());
    }

    @Override
    public BigInteger unitPrice(String token) {
        return prices.getOrDefault(token, BigInteger.ONE);
    }
}
