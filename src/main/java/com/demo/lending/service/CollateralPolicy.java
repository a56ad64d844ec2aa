package com.demo.lending.service;

import com.demo.lending.repository.AccountSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;

/**
 * 150% collateralization rule, evaluated in USD across every token an account holds.
 */
@Component
@RequiredArgsConstructor
public class CollateralPolicy {

    private static final BigInteger RATIO_NUMERATOR = BigInteger.valueOf(3);
    private static final BigInteger RATIO_DENOMINATOR = BigInteger.valueOf(2);

    private final PriceOracle priceOracle;

    /** {@code borrowedUsd * 3 / 2}, truncated. */
    public BigInteger requiredCollateral(BigInteger borrowedUsd) {
        return borrowedUsd.multiply(RATIO_NUMERATOR).divide(RATIO_DENOMINATOR);
    }

    public BigInteger toUsd(String token, BigInteger amount) {
        return amount.multiply(priceOracle.unitPrice(token));
    }

    public BigInteger toUsd(Map<String, BigInteger> positions) {
        BigInteger total = BigInteger.ZERO;
        for (Map.Entry<String, BigInteger> e : positions.entrySet()) {
            total = total.add(toUsd(e.getKey(), e.getValue()));
        }
        return total;
    }

    public UsdPosition positionOf(AccountSnapshot account) {
        return new UsdPosition(
                toUsd(account.collateral()),
                toUsd(account.borrowed()),
                toUsd(account.deposited()));
    }

    public PolicyCheck checkBorrow(AccountSnapshot account, String token, BigInteger amount) {
        BigInteger borrowedAfter = toUsd(account.borrowed()).add(toUsd(token, amount));
        if (toUsd(account.collateral()).compareTo(requiredCollateral(borrowedAfter)) < 0) {
            return PolicyCheck.violation("Insufficient collateral to borrow requested amount");
        }
        return PolicyCheck.pass();
    }

    public PolicyCheck checkCollateralDeposit(AccountSnapshot account, String token, BigInteger amount) {
        BigInteger collateralAfter = toUsd(account.collateral()).add(toUsd(token, amount));
        if (collateralAfter.compareTo(requiredCollateral(toUsd(account.borrowed()))) < 0) {
            return PolicyCheck.violation("Collateral insufficient for current borrowed amount");
        }
        return PolicyCheck.pass();
    }

    public PolicyCheck checkWithdrawal(AccountSnapshot account, String token, BigInteger amount) {
        if (account.collateral(token).compareTo(amount) < 0) {
            return PolicyCheck.violation("Insufficient collateral to withdraw");
        }
        BigInteger remaining = toUsd(account.collateral()).subtract(toUsd(token, amount));
        if (remaining.compareTo(requiredCollateral(toUsd(account.borrowed()))) < 0) {
            return PolicyCheck.violation("Cannot withdraw: would breach minimum collateral");
        }
        return PolicyCheck.pass();
    }
}
