package com.demo.lending.service.risk;

import com.demo.lending.service.dto.RiskRequest;
import com.demo.lending.service.dto.RiskResponse;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LogisticRegressionRiskScorerTest {

    private final LogisticRegressionRiskScorer scorer = new LogisticRegressionRiskScorer();

    private static RiskRequest request(int volatility, long collateral, long borrowed, long deposits, long credit) {
        return new RiskRequest(BigInteger.valueOf(collateral), BigInteger.valueOf(borrowed),
                BigInteger.valueOf(deposits), volatility, BigInteger.valueOf(credit));
    }

    @Test
    void smallWellCollateralizedPositionIsSafe() {
        RiskResponse response = scorer.score(request(10, 150, 100, 0, 700));

        assertThat(response.getRiskScore()).isZero();
        assertThat(response.getAdvice()).isEqualTo("Safe to borrow");
        assertThat(response.getProbability()).isCloseTo(0.18, within(0.02));
    }

    @Test
    void largeUncollateralizedDebtIsHighRisk() {
        RiskResponse response = scorer.score(request(500, 0, 1_000_000, 0, 300));

        assertThat(response.getRiskScore()).isEqualTo(1);
        assertThat(response.getAdvice()).isEqualTo("High risk (prob 1.00), consider increasing collateral");
    }

    @Test
    void probabilityAtTheMeansIsSigmoidOfIntercept() {
        double p = scorer.probability(new double[]{0.254960, 774717.027074, 499839.415540, 1000172.144719, 574.696362});

        assertThat(p).isCloseTo(1.0 / (1.0 + Math.exp(-2.262179)), within(1e-9));
    }
}
