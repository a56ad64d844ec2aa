package com.demo.lending.repository;

import java.math.BigInteger;
import java.time.Instant;

public record MintLogEntry(long sequence, String user, String token, BigInteger amount, Instant recordedAt) {
}
