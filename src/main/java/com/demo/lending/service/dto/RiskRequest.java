package com.demo.lending.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * Risk Service request. Positions are whole USD; {@code volatility} is the
 * borrowed/deposits ratio scaled by 1000.
 */
public record RiskRequest(
        @NotNull BigInteger collateral,
        @NotNull BigInteger borrowed,
        @NotNull BigInteger deposits,
        @Min(10) @Max(500) int volatility,
        @NotNull @JsonProperty("credit_score") BigInteger creditScore
) {
}
