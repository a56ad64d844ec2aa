package com.demo.lending.service.risk;

import com.demo.lending.config.LendingProperties;
import com.demo.lending.repository.AccountSnapshot;
import com.demo.lending.repository.AccountStore;
import com.demo.lending.service.CollateralPolicy;
import com.demo.lending.service.UsdPosition;
import com.demo.lending.service.dto.RiskRequest;
import com.demo.lending.service.dto.RiskResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Advisory risk check around the external Risk Service.
 * <p>
 * Fail-open: anything other than an explicit high-risk answer (no address configured,
 * transport error, timeout, malformed body) comes back as {@code UNAVAILABLE} and callers
 * let the operation stand. Must be called without holding the ledger lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskGate {

    public static final String UNAVAILABLE_ADVICE = "AI service unavailable";
    // used when the service answers without advice text
    static final String DEFAULT_SAFE_ADVICE = "Safe to borrow";
    static final String DEFAULT_HIGH_RISK_ADVICE = "High risk, consider increasing collateral";

    private final RiskServiceEndpoint endpoint;
    private final RiskServicePort riskService;
    private final AccountStore accountStore;
    private final CollateralPolicy collateralPolicy;
    private final LendingProperties props;

    public RiskVerdict evaluate(AccountSnapshot account) {
        Optional<String> baseUrl = endpoint.current();
        if (baseUrl.isEmpty()) {
            log.debug("No risk service configured; skipping risk check for {}", account.user());
            return RiskVerdict.unavailable();
        }

        RiskRequest request = buildRequest(account);
        log.debug("Calling risk service {} for {} with {}", baseUrl.get(), account.user(), request);

        RiskResponse response;
        try {
            response = riskService.assess(baseUrl.get(), request);
        } catch (Exception ex) {
            log.warn("Risk service call failed for {}: {}", account.user(), ex.toString());
            return unavailable(account.user());
        }
        if (response == null || response.getRiskScore() == null
                || (response.getRiskScore() != 0 && response.getRiskScore() != 1)) {
            log.warn("Risk service returned malformed payload for {}: {}", account.user(), response);
            return unavailable(account.user());
        }

        RiskVerdict.Outcome outcome = response.getRiskScore() == 1
                ? RiskVerdict.Outcome.HIGH_RISK : RiskVerdict.Outcome.SAFE;
        String advice = StringUtils.hasText(response.getAdvice())
                ? response.getAdvice()
                : (outcome == RiskVerdict.Outcome.HIGH_RISK ? DEFAULT_HIGH_RISK_ADVICE : DEFAULT_SAFE_ADVICE);
        accountStore.recordRiskAdvice(account.user(), advice);
        log.info("Risk verdict for {}: {} ({})", account.user(), outcome, advice);
        return new RiskVerdict(outcome, response.getProbability(), advice);
    }

    RiskRequest buildRequest(AccountSnapshot account) {
        UsdPosition position = collateralPolicy.positionOf(account);
        return new RiskRequest(
                position.collateralUsd(),
                position.borrowedUsd(),
                position.depositsUsd(),
                scaledVolatility(position),
                account.creditScore());
    }

    /** borrowed/deposits clamped to the configured band, times 1000, rounded. */
    int scaledVolatility(UsdPosition position) {
        LendingProperties.Risk cfg = props.getRisk();
        double volatility = position.depositsUsd().signum() > 0
                ? position.borrowedUsd().doubleValue() / position.depositsUsd().doubleValue()
                : cfg.getVolatilityFloor();
        volatility = Math.max(cfg.getVolatilityMin(), Math.min(cfg.getVolatilityMax(), volatility));
        return (int) Math.round(volatility * 1000.0);
    }

    private RiskVerdict unavailable(String user) {
        accountStore.recordRiskAdvice(user, UNAVAILABLE_ADVICE);
        return RiskVerdict.unavailable();
    }
}
