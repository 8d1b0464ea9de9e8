package com.chainscope.domain;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * @param balance raw on-chain amount
 */
public record TokenBalance(
        String contractAddress,
        String name,
        String symbol,
        int decimals,
        BigInteger balance
) {

    public BigDecimal amount() {
        return new BigDecimal(balance, decimals);
    }
}
