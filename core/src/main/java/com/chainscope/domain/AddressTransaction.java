package com.chainscope.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One row of an address history list.
 *
 * @param method resolved function name, method id or selector; empty for plain transfers
 * @param to     null for contract creation
 * @param fee    gasUsed × gasPrice in wei
 */
public record AddressTransaction(
        String hash,
        String method,
        long blockNumber,
        Instant timestamp,
        String from,
        String to,
        BigInteger value,
        BigInteger fee,
        TransactionStatus status
) {
}
