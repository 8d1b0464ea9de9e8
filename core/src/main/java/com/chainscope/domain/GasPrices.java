package com.chainscope.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Gas price tiers in wei, derived from the node's current gas price.
 */
public record GasPrices(BigInteger slow, BigInteger standard, BigInteger fast, Instant timestamp) {

    public static GasPrices fromStandard(BigInteger standard, Instant timestamp) {
        BigInteger hundred = BigInteger.valueOf(100);
        BigInteger slow = standard.multiply(BigInteger.valueOf(80)).divide(hundred);
        BigInteger fast = standard.multiply(BigInteger.valueOf(120)).divide(hundred);
        return new GasPrices(slow, standard, fast, timestamp);
    }
}
