package com.demo.lending.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "lending")
@Data
@Validated
public class LendingProperties {

    @NotBlank
    private String version = "lending-pool v1.0.0";

    @NotNull
    private BigInteger defaultCreditScore = BigInteger.valueOf(700);

    /** Identity that receives deposited funds on the external token ledger. */
    @NotBlank
    private String custodyAddress = "lending-pool";

    /** Fixed USD unit price per token; unlisted tokens price at 1. */
    private Map<String, BigInteger> prices = new LinkedHashMap<>();

    /** Supported tokens seeded at start-up: token -> external contract address. */
    private Map<String, String> tokens = new LinkedHashMap<>();

    @Valid
    private Risk risk = new Risk();

    @Valid
    private TokenLedger tokenLedger = new TokenLedger();

    @Data
    public static class Risk {
        /** Blank means unset: the risk gate then reports UNAVAILABLE without calling out. */
        private String baseUrl = "";

        @Positive
        private double volatilityFloor = 0.01;

        @Positive
        private double volatilityMin = 0.01;

        @Positive
        private double volatilityMax = 0.5;

        @Positive
        private int connectTimeoutMs = 5000;

        @Positive
        private int readTimeoutMs = 8000;
    }

    @Data
    public static class TokenLedger {
        /** memory | web3 */
        @NotBlank
        private String mode = "memory";

        private String rpcUrl = "http://localhost:8545";

        private String privateKey = "";

        private long chainId = 1337;

        @NotNull
        private BigInteger gasPrice = BigInteger.valueOf(20_000_000_000L);

        @NotNull
        private BigInteger gasLimit = BigInteger.valueOf(300_000);

        @Positive
        private long receiptPollMs = 1000;

        @Min(1)
        private int receiptPollAttempts = 40;
    }
}
