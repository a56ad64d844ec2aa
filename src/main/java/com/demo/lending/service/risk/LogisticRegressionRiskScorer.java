package com.demo.lending.service.risk;

import com.demo.lending.service.dto.RiskRequest;
import com.demo.lending.service.dto.RiskResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;

/**
 * Fixed logistic-regression model over
 * {@code [volatility, collateral, borrowed, deposits, credit_score]}.
 * Features are standardized with the training means/stds before the linear step.
 */
@Slf4j
@Component
public class LogisticRegressionRiskScorer implements RiskScorer {

    private static final double[] MEANS = {0.254960, 774717.027074, 499839.415540, 1000172.144719, 574.696362};
    private static final double[] STDS = {0.141482, 418514.422291, 288655.995022, 577065.613148, 158.832794};
    private static final double[] WEIGHTS = {1.893918, -1.209705, 0.795901, 0.000843, -1.698044};
    private static final double INTERCEPT = 2.262179;
    private static final double THRESHOLD = 0.5;

    @Override
    public RiskResponse score(RiskRequest request) {
        double[] features = {
                request.volatility() / 1000.0,
                request.collateral().doubleValue(),
                request.borrowed().doubleValue(),
                request.deposits().doubleValue(),
                request.creditScore().doubleValue()
        };
        double probability = probability(features);
        int riskScore = probability >= THRESHOLD ? 1 : 0;
        log.debug("Features {} -> p={}", Arrays.toString(features), probability);

        String advice = riskScore == 0
                ? "Safe to borrow"
                : String.format(Locale.ROOT, "High risk (prob %.2f), consider increasing collateral", probability);
        return new RiskResponse(riskScore, advice, probability);
    }

    @Override
    public String version() {
        return "risk-scorer v1.0.0";
    }

    double probability(double[] features) {
        double z = INTERCEPT;
        for (int i = 0; i < features.length; i++) {
            z += WEIGHTS[i] * (features[i] - MEANS[i]) / STDS[i];
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }
}
