package com.chainscope.domain;

import java.time.Instant;

/**
 * Verified-source metadata of a contract. Fields other than {@code address} and
 * {@code verified} are null for unverified contracts.
 */
public record ContractInfo(
        String address,
        String name,
        String sourceCode,
        String abi,
        String compilerVersion,
        boolean verified,
        Instant lastUpdated
) {
}
