package com.demo.lending.service.risk;

import com.demo.lending.config.LendingProperties;
import com.demo.lending.repository.AccountSnapshot;
import com.demo.lending.repository.AccountStore;
import com.demo.lending.service.CollateralPolicy;
import com.demo.lending.service.UsdPosition;
import com.demo.lending.service.dto.RiskRequest;
import com.demo.lending.service.dto.RiskResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RiskGateTest {

    @Mock
    private RiskServicePort riskService;

    private LendingProperties props;
    private AccountStore accounts;
    private RiskServiceEndpoint endpoint;
    private RiskGate gate;

    @BeforeEach
    void setUp() {
        props = new LendingProperties();
        props.setPrices(Map.of("ICP", BigInteger.valueOf(5)));
        accounts = new AccountStore(props);
        accounts.signup("alice", "Alice");
        endpoint = new RiskServiceEndpoint(props);
        CollateralPolicy policy = new CollateralPolicy(token -> props.getPrices().getOrDefault(token, BigInteger.ONE));
        gate = new RiskGate(endpoint, riskService, accounts, policy, props);
    }

    private AccountSnapshot alice() {
        return accounts.snapshot("alice").orElseThrow();
    }

    private static UsdPosition position(long collateral, long borrowed, long deposits) {
        return new UsdPosition(BigInteger.valueOf(collateral), BigInteger.valueOf(borrowed), BigInteger.valueOf(deposits));
    }

    @Test
    void unsetAddressSkipsTheCall() {
        RiskVerdict verdict = gate.evaluate(alice());

        assertThat(verdict.outcome()).isEqualTo(RiskVerdict.Outcome.UNAVAILABLE);
        assertThat(alice().riskAdvice()).isNull();
        verifyNoInteractions(riskService);
    }

    @Test
    void highRiskAnswerIsReportedAndAdviceStored() throws Exception {
        endpoint.set("http://risk.local");
        when(riskService.assess(eq("http://risk.local"), any()))
                .thenReturn(new RiskResponse(1, "High risk (prob 0.81), consider increasing collateral", 0.81));

        RiskVerdict verdict = gate.evaluate(alice());

        assertThat(verdict.isHighRisk()).isTrue();
        assertThat(verdict.probability()).isEqualTo(0.81);
        assertThat(alice().riskAdvice()).startsWith("High risk");
    }

    @Test
    void malformedScoreIsTreatedAsUnavailable() throws Exception {
        endpoint.set("http://risk.local");
        when(riskService.assess(any(), any())).thenReturn(new RiskResponse(7, "??", null));

        RiskVerdict verdict = gate.evaluate(alice());

        assertThat(verdict.outcome()).isEqualTo(RiskVerdict.Outcome.UNAVAILABLE);
        assertThat(alice().riskAdvice()).isEqualTo(RiskGate.UNAVAILABLE_ADVICE);
    }

    @Test
    void emptyBodyIsTreatedAsUnavailable() throws Exception {
        endpoint.set("http://risk.local");
        when(riskService.assess(any(), any())).thenReturn(null);

        assertThat(gate.evaluate(alice()).isHighRisk()).isFalse();
        assertThat(alice().riskAdvice()).isEqualTo(RiskGate.UNAVAILABLE_ADVICE);
    }

    @Test
    void highRiskAnswerWithoutAdviceStillRecordsText() throws Exception {
        accounts.recordRiskAdvice("alice", "Safe to borrow");
        endpoint.set("http://risk.local");
        when(riskService.assess(any(), any())).thenReturn(new RiskResponse(1, null, 0.77));

        RiskVerdict verdict = gate.evaluate(alice());

        assertThat(verdict.isHighRisk()).isTrue();
        assertThat(verdict.advice()).isEqualTo(RiskGate.DEFAULT_HIGH_RISK_ADVICE);
        assertThat(alice().riskAdvice()).isEqualTo(RiskGate.DEFAULT_HIGH_RISK_ADVICE);
    }

    @Test
    void safeAnswerWithBlankAdviceReplacesEarlierText() throws Exception {
        accounts.recordRiskAdvice("alice", "Insufficient collateral to borrow requested amount");
        endpoint.set("http://risk.local");
        when(riskService.assess(any(), any())).thenReturn(new RiskResponse(0, "", null));

        assertThat(gate.evaluate(alice()).advice()).isEqualTo(RiskGate.DEFAULT_SAFE_ADVICE);
        assertThat(alice().riskAdvice()).isEqualTo(RiskGate.DEFAULT_SAFE_ADVICE);
    }

    @Test
    void requestCarriesUsdPositionsAndCreditScore() throws Exception {
        endpoint.set("http://risk.local");
        when(riskService.assess(any(), any())).thenReturn(new RiskResponse(0, "Safe to borrow", 0.2));
        // balance includes 100 USDT of borrow proceeds; only the ICP deposit counts as deposits
        AccountSnapshot account = new AccountSnapshot("alice", "Alice",
                Map.of("ICP", BigInteger.valueOf(100), "USDT", BigInteger.valueOf(100)),
                Map.of("ICP", BigInteger.valueOf(60)),
                Map.of("USDT", BigInteger.valueOf(100)),
                Map.of("ICP", BigInteger.valueOf(100)),
                BigInteger.valueOf(700), null);

        gate.evaluate(account);

        ArgumentCaptor<RiskRequest> captor = ArgumentCaptor.forClass(RiskRequest.class);
        verify(riskService).assess(eq("http://risk.local"), captor.capture());
        RiskRequest sent = captor.getValue();
        assertThat(sent.collateral()).isEqualTo(BigInteger.valueOf(300));
        assertThat(sent.borrowed()).isEqualTo(BigInteger.valueOf(100));
        assertThat(sent.deposits()).isEqualTo(BigInteger.valueOf(500));
        assertThat(sent.volatility()).isEqualTo(200);
        assertThat(sent.creditScore()).isEqualTo(BigInteger.valueOf(700));
    }

    @Test
    void volatilityIsClampedAndScaled() {
        assertThat(gate.scaledVolatility(position(0, 0, 0))).isEqualTo(10);
        assertThat(gate.scaledVolatility(position(0, 1, 1000))).isEqualTo(10);
        assertThat(gate.scaledVolatility(position(0, 250, 1000))).isEqualTo(250);
        assertThat(gate.scaledVolatility(position(0, 5000, 1000))).isEqualTo(500);
        assertThat(gate.scaledVolatility(position(0, 100, 0))).isEqualTo(10);
    }
}
