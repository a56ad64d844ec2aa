package com.demo.lending.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public final class PoolDtos {
    private PoolDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SignupRequest {
        @NotBlank
        public String username;
    }

    /** Body of every token/amount operation (deposit, collateral, borrow, repay, withdraw, contribute). */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AmountRequest {
        @NotBlank
        public String token;
        @NotNull
        public BigInteger amount;
    }
}
