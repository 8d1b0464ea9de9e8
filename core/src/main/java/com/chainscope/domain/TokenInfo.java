package com.chainscope.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * ERC-20 metadata read from the token contract.
 *
 * @param totalSupply null when the contract does not answer totalSupply()
 */
public record TokenInfo(
        String contractAddress,
        String name,
        String symbol,
        int decimals,
        BigInteger totalSupply,
        Instant lastUpdated
) {
}
