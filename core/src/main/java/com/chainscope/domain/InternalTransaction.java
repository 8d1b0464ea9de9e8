package com.chainscope.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Value transfer made by contract execution (trace), keyed by its parent transaction hash.
 *
 * @param type call type reported by the tracer, "call" when absent
 */
public record InternalTransaction(
        String parentTransactionHash,
        long blockNumber,
        Instant timestamp,
        String from,
        String to,
        BigInteger value,
        BigInteger gasLimit,
        BigInteger gasUsed,
        String type
) {
}
