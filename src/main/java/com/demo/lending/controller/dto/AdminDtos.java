package com.demo.lending.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

import java.math.BigInteger;

public final class AdminDtos {
    private AdminDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AddressRequest {
        @NotBlank
        public String address;   // risk service base URL or token contract address
    }

    // dev-only token operations (memory ledger)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GrantRequest {
        @NotBlank
        public String owner;
        public BigInteger amount;
    }
}
