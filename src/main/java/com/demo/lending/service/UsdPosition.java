package com.demo.lending.service;

import java.math.BigInteger;

/** An account's positions aggregated to whole USD. */
public record UsdPosition(BigInteger collateralUsd, BigInteger borrowedUsd, BigInteger depositsUsd) {
}
